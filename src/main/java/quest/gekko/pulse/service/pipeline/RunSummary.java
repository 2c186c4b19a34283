package quest.gekko.pulse.service.pipeline;

import lombok.Getter;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.service.aggregation.AggregationOutcome;
import quest.gekko.pulse.service.ingest.IngestOutcome;
import quest.gekko.pulse.service.ingest.RejectionReason;
import quest.gekko.pulse.service.scoring.ScoringOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Health counters of one pipeline invocation, for the scheduler and the dashboard.
 */
@Getter
public class RunSummary {
    private final String runId = UUID.randomUUID().toString();
    private final String operation;
    private final Instant startedAt;
    private Instant finishedAt;

    private int received;
    private int ingested;
    private int duplicatesMerged;
    private final Map<RejectionReason, Integer> rejected = new EnumMap<>(RejectionReason.class);
    private int storeFailures;

    private final Map<SentimentModel, Integer> scoredByModel = new EnumMap<>(SentimentModel.class);
    private int skippedAlreadyScored;
    private int scoringFailures;
    private int fallbacks;
    private int deferred;

    private int aggregatesRecomputed;
    private int aggregationFailures;
    private final List<String> failedBuckets = new ArrayList<>();

    private final List<String> collectorErrors = new ArrayList<>();

    public RunSummary(String operation, Instant startedAt) {
        this.operation = operation;
        this.startedAt = startedAt;
    }

    public RunSummary add(IngestOutcome outcome) {
        received += outcome.received();
        ingested += outcome.created();
        duplicatesMerged += outcome.merged();
        storeFailures += outcome.storeFailures();
        outcome.rejected().forEach((reason, n) -> rejected.merge(reason, n, Integer::sum));
        return this;
    }

    public RunSummary add(ScoringOutcome outcome) {
        outcome.scoredByModel().forEach((model, n) -> scoredByModel.merge(model, n, Integer::sum));
        skippedAlreadyScored += outcome.skipped();
        scoringFailures += outcome.failures();
        fallbacks += outcome.fallbacks();
        deferred += outcome.deferred();
        return this;
    }

    public RunSummary add(AggregationOutcome outcome) {
        aggregatesRecomputed += outcome.recomputed();
        aggregationFailures += outcome.failures();
        failedBuckets.addAll(outcome.failedBuckets());
        return this;
    }

    public RunSummary collectorFailed(String source, String message) {
        collectorErrors.add(source + ": " + message);
        return this;
    }

    public RunSummary finish(Instant at) {
        this.finishedAt = at;
        return this;
    }

    public int getRejectedTotal() {
        return rejected.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** True when a bucket could not be aggregated; callers should alert on this. */
    public boolean isFailed() {
        return aggregationFailures > 0;
    }

    @Override
    public String toString() {
        return operation + " run " + runId + ": received=" + received + ", ingested=" + ingested
                + ", merged=" + duplicatesMerged + ", rejected=" + getRejectedTotal() + ", storeFailures=" + storeFailures
                + ", scored=" + scoredByModel + ", skipped=" + skippedAlreadyScored
                + ", scoringFailures=" + scoringFailures + ", fallbacks=" + fallbacks + ", deferred=" + deferred
                + ", aggregates=" + aggregatesRecomputed + ", aggregationFailures=" + aggregationFailures;
    }
}
