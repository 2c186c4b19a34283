package quest.gekko.pulse.service.aggregation;

import lombok.RequiredArgsConstructor;
import quest.gekko.pulse.config.PipelineSettings;

import java.util.Comparator;
import java.util.List;

/**
 * Folds the rows of one bucket into counts, mean and population standard deviation.
 *
 * Buckets: {@code polarity >= positiveThreshold} is positive, {@code polarity <= negativeThreshold}
 * negative, anything between neutral. Rows under the confidence floor are handled by the
 * {@link LowConfidencePolicy}. Mean and stddev are rounded to six decimals and taken over the
 * {@code meanCount} rows at or above the floor; with no such row both are zero.
 */
@RequiredArgsConstructor
public class AggregateCalculator {
    private static final double SCALE = 1_000_000d;

    private final double positiveThreshold;
    private final double negativeThreshold;
    private final double confidenceFloor;
    private final LowConfidencePolicy policy;

    public static AggregateCalculator from(PipelineSettings settings) {
        return new AggregateCalculator(settings.getPositiveThreshold(), settings.getNegativeThreshold(),
                settings.getConfidenceFloor(), settings.getLowConfidencePolicy());
    }

    public BucketStats compute(List<ScoredRow> input) {
        List<ScoredRow> rows = input.stream().sorted(Comparator.comparing(ScoredRow::key)).toList();

        int count = 0, positive = 0, neutral = 0, negative = 0, lowConfidence = 0, fallback = 0;
        int meanRows = 0;
        double sum = 0.0;
        for (ScoredRow row : rows) {
            boolean low = row.confidence() < confidenceFloor;
            if (low) {
                lowConfidence++;
                if (policy == LowConfidencePolicy.EXCLUDE) continue;
            }
            count++;
            if (row.fallback()) fallback++;
            if (row.polarity() >= positiveThreshold) positive++;
            else if (row.polarity() <= negativeThreshold) negative++;
            else neutral++;
            if (!low) {
                sum += row.polarity();
                meanRows++;
            }
        }
        if (meanRows == 0) {
            return new BucketStats(count, 0.0, 0.0, positive, neutral, negative, lowConfidence, fallback, 0);
        }

        double mean = sum / meanRows;
        double squares = 0.0;
        for (ScoredRow row : rows) {
            if (row.confidence() < confidenceFloor) continue;
            double d = row.polarity() - mean;
            squares += d * d;
        }
        double stddev = Math.sqrt(squares / meanRows);
        return new BucketStats(count, round(mean), round(stddev), positive, neutral, negative, lowConfidence, fallback, meanRows);
    }

    static double round(double value) {
        double r = Math.round(value * SCALE) / SCALE;
        return r == 0.0 ? 0.0 : r; // no -0.0
    }
}
