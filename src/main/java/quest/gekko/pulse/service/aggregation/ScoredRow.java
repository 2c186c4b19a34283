package quest.gekko.pulse.service.aggregation;

/**
 * One input row of a bucket. {@code key} orders the rows so sums come out the same on every run.
 */
public record ScoredRow(String key, double polarity, double confidence, boolean fallback) {}
