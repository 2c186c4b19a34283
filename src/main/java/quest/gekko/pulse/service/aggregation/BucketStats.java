package quest.gekko.pulse.service.aggregation;

public record BucketStats(int count,
                          double meanPolarity,
                          double stddevPolarity,
                          int positiveCount,
                          int neutralCount,
                          int negativeCount,
                          int lowConfidenceCount,
                          int fallbackCount,
                          int meanCount) {

    public static final BucketStats EMPTY = new BucketStats(0, 0.0, 0.0, 0, 0, 0, 0, 0, 0);
}
