package quest.gekko.pulse.service.scoring;

/** One class probability as returned by a text-classification endpoint. */
public record LabelScore(String label, double score) {}
