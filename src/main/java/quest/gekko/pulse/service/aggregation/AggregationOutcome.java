package quest.gekko.pulse.service.aggregation;

import java.util.List;

public record AggregationOutcome(int recomputed, int failures, List<String> failedBuckets) {

    public AggregationOutcome {
        failedBuckets = List.copyOf(failedBuckets);
    }

    public static AggregationOutcome empty() {
        return new AggregationOutcome(0, 0, List.of());
    }
}
