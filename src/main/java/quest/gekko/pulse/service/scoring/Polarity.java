package quest.gekko.pulse.service.scoring;

/**
 * A model's verdict on one text: polarity in [-1, 1], confidence in [0, 1].
 */
public record Polarity(double polarity, double confidence) {
    public static final Polarity NEUTRAL = new Polarity(0.0, 1.0);

    public Polarity {
        if (Double.isNaN(polarity) || polarity < -1.0 || polarity > 1.0) {
            throw new IllegalArgumentException("polarity out of range: " + polarity);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
    }
}
