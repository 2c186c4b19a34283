package quest.gekko.pulse.service.scoring;

import quest.gekko.pulse.domain.SentimentModel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters for one scoring pass. {@code scoredByModel} is keyed by the model that actually
 * produced the rows, so fallbacks show up under LEXICON.
 */
public record ScoringOutcome(Map<SentimentModel, Integer> scoredByModel,
                             int skipped,
                             int failures,
                             int fallbacks,
                             int deferred) {

    public ScoringOutcome {
        EnumMap<SentimentModel, Integer> copy = new EnumMap<>(SentimentModel.class);
        copy.putAll(scoredByModel);
        scoredByModel = Collections.unmodifiableMap(copy);
    }

    public static ScoringOutcome empty() {
        return new ScoringOutcome(Map.of(), 0, 0, 0, 0);
    }

    public static ScoringOutcome scored(SentimentModel model, int count) {
        return new ScoringOutcome(count == 0 ? Map.of() : Map.of(model, count), 0, 0, 0, 0);
    }

    public int scored(SentimentModel model) {
        return scoredByModel.getOrDefault(model, 0);
    }

    public int totalScored() {
        return scoredByModel.values().stream().mapToInt(Integer::intValue).sum();
    }

    public ScoringOutcome plus(ScoringOutcome other) {
        EnumMap<SentimentModel, Integer> merged = new EnumMap<>(SentimentModel.class);
        merged.putAll(scoredByModel);
        other.scoredByModel.forEach((m, n) -> merged.merge(m, n, Integer::sum));
        return new ScoringOutcome(merged,
                skipped + other.skipped,
                failures + other.failures,
                fallbacks + other.fallbacks,
                deferred + other.deferred);
    }

    public ScoringOutcome withSkipped(int count) {
        return new ScoringOutcome(scoredByModel, skipped + count, failures, fallbacks, deferred);
    }

    public ScoringOutcome withFailures(int count) {
        return new ScoringOutcome(scoredByModel, skipped, failures + count, fallbacks, deferred);
    }

    public ScoringOutcome withFallbacks(int count) {
        return new ScoringOutcome(scoredByModel, skipped, failures, fallbacks + count, deferred);
    }

    public ScoringOutcome withDeferred(int count) {
        return new ScoringOutcome(scoredByModel, skipped, failures, fallbacks, deferred + count);
    }
}
