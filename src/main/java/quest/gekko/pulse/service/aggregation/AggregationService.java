package quest.gekko.pulse.service.aggregation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.AggregateId;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.SentimentScore;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.domain.SurveyResponse;
import quest.gekko.pulse.exception.AggregationIntegrityException;
import quest.gekko.pulse.service.ingest.TitleRegistry;
import quest.gekko.pulse.service.store.PipelineStore;
import quest.gekko.pulse.util.KeyedLocks;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Recomputes {@link DailyAggregate} buckets from scratch. Recomputes of the same
 * (title, source, day) are serialised; different buckets run in parallel.
 */
@Slf4j
@Service
public class AggregationService {
    public static final List<String> DASHBOARD_CACHES = List.of("aggregates", "alignment");

    private final PipelineStore store;
    private final TitleRegistry titles;
    private final PipelineSettings settings;
    private final Clock clock;
    private final CacheManager cacheManager;
    private final Executor executor;
    private final AggregateCalculator calculator;
    private final KeyedLocks<AggregateId> locks = new KeyedLocks<>();

    public AggregationService(PipelineStore store,
                              TitleRegistry titles,
                              PipelineSettings settings,
                              Clock clock,
                              CacheManager cacheManager,
                              @Qualifier("aggregationExecutor") Executor executor) {
        this.store = store;
        this.titles = titles;
        this.settings = settings;
        this.clock = clock;
        this.cacheManager = cacheManager;
        this.executor = executor;
        this.calculator = AggregateCalculator.from(settings);
    }

    /**
     * Rebuilds one bucket from the current scores or survey responses and replaces the stored row.
     *
     * @throws AggregationIntegrityException for an unknown title, an invalid source or a day
     *                                       outside the retention window
     */
    public DailyAggregate aggregate(String titleId, String source, LocalDate date) {
        String src = Sources.normalize(source);
        checkIntegrity(titleId, src, date);
        DailyAggregate stored = locks.withLock(new AggregateId(titleId, src, date),
                () -> store.putAggregate(compute(titleId, src, date)));
        evictDashboardCaches();
        return stored;
    }

    /**
     * Recomputes every bucket for the titles and days given. A null or empty source list means
     * every configured platform, every platform seen in the range, {@code social} and {@code survey}.
     * Failing buckets are logged and counted; the others still run.
     */
    public AggregationOutcome aggregateRange(Collection<String> titleIds, Collection<String> sources,
                                             LocalDate from, LocalDate to) {
        List<AggregateId> keys = new ArrayList<>();
        for (String titleId : titleIds) {
            Set<String> bucketSources = sources == null || sources.isEmpty()
                    ? defaultSources(titleId, from, to)
                    : sources.stream().map(Sources::normalize).collect(Collectors.toCollection(LinkedHashSet::new));
            for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
                for (String source : bucketSources) {
                    keys.add(new AggregateId(titleId, source, day));
                }
            }
        }
        return aggregateAll(keys);
    }

    public AggregationOutcome aggregateAll(Collection<AggregateId> keys) {
        List<AggregateId> distinct = List.copyOf(new LinkedHashSet<>(keys));
        List<CompletableFuture<Optional<String>>> futures = distinct.stream()
                .map(k -> CompletableFuture.supplyAsync(() -> recompute(k), executor))
                .toList();

        int recomputed = 0;
        List<String> failed = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Optional<String> failure;
            try {
                failure = futures.get(i).join();
            } catch (CompletionException e) {
                AggregateId k = distinct.get(i);
                log.error("Aggregation of {}/{}/{} failed", k.getTitleId(), k.getSource(), k.getDate(), e.getCause());
                failure = Optional.of(describe(k) + ": " + e.getCause().getMessage());
            }
            if (failure.isPresent()) failed.add(failure.get());
            else recomputed++;
        }
        if (!failed.isEmpty()) {
            log.error("{} of {} buckets could not be aggregated", failed.size(), distinct.size());
        }
        return new AggregationOutcome(recomputed, failed.size(), failed);
    }

    private Optional<String> recompute(AggregateId key) {
        try {
            aggregate(key.getTitleId(), key.getSource(), key.getDate());
            return Optional.empty();
        } catch (AggregationIntegrityException e) {
            log.error("Skipping bucket {}: {}", describe(key), e.getMessage());
            return Optional.of(describe(key) + ": " + e.getMessage());
        }
    }

    DailyAggregate compute(String titleId, String source, LocalDate date) {
        Instant from = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return Sources.SURVEY.equals(source)
                ? computeSurvey(titleId, date, store.getResponses(titleId, from, to))
                : computeSocial(titleId, source, date, store.getScores(titleId, from, to));
    }

    private DailyAggregate computeSocial(String titleId, String source, LocalDate date, List<SentimentScore> scores) {
        SentimentModel model = settings.getAggregationModel();
        Map<String, List<SentimentScore>> byItem = scores.stream()
                .filter(s -> Sources.SOCIAL.equals(source) || source.equals(s.getSource()))
                .collect(Collectors.groupingBy(SentimentScore::getItemId, TreeMap::new, Collectors.toList()));

        List<ScoredRow> rows = new ArrayList<>(byItem.size());
        byItem.forEach((itemId, itemScores) -> pick(itemScores, model)
                .ifPresent(s -> rows.add(new ScoredRow(itemId, s.getPolarity(), s.getConfidence(), s.getModel() != model))));

        return fill(DailyAggregate.empty(titleId, source, date, model), calculator.compute(rows));
    }

    /**
     * The row that stands for an item under {@code model}: its own row, or for the transformer
     * the lexicon row written when the transformer failed on that item. Only the latter counts
     * as a fallback in the bucket.
     */
    static Optional<SentimentScore> pick(List<SentimentScore> itemScores, SentimentModel model) {
        Optional<SentimentScore> own = itemScores.stream().filter(s -> s.getModel() == model).findFirst();
        if (own.isPresent() || model == SentimentModel.LEXICON) return own;
        return itemScores.stream()
                .filter(s -> s.isFallback() && s.getRequestedModel() == model)
                .findFirst();
    }

    private DailyAggregate computeSurvey(String titleId, LocalDate date, List<SurveyResponse> responses) {
        List<SurveyResponse> sorted = responses.stream()
                .sorted(Comparator.comparing(SurveyResponse::getRespondentId))
                .toList();
        List<ScoredRow> rows = sorted.stream()
                .map(r -> new ScoredRow(r.getRespondentId(), rescale(r.getSatisfaction()), 1.0, false))
                .toList();
        DailyAggregate aggregate = fill(DailyAggregate.empty(titleId, Sources.SURVEY, date, null), calculator.compute(rows));
        if (sorted.isEmpty()) return aggregate;

        aggregate.setMeanSatisfaction(AggregateCalculator.round(
                sorted.stream().mapToInt(SurveyResponse::getSatisfaction).average().orElse(0.0)));
        List<Boolean> recommends = sorted.stream().map(SurveyResponse::getWouldRecommend).filter(b -> b != null).toList();
        if (!recommends.isEmpty()) {
            aggregate.setRecommendationRate(AggregateCalculator.round(
                    recommends.stream().filter(Boolean::booleanValue).count() / (double) recommends.size()));
        }
        List<Double> completions = sorted.stream().map(SurveyResponse::getCompletionRate).filter(c -> c != null).toList();
        if (!completions.isEmpty()) {
            aggregate.setMeanCompletionRate(AggregateCalculator.round(
                    completions.stream().mapToDouble(Double::doubleValue).sum() / completions.size()));
        }
        return aggregate;
    }

    /** Maps a satisfaction rating onto [-1, 1]; the middle of the scale is 0. */
    public double rescale(int satisfaction) {
        double min = settings.getSurveyScaleMin();
        double max = settings.getSurveyScaleMax();
        double clamped = Math.max(min, Math.min(max, satisfaction));
        return (clamped - min) / (max - min) * 2.0 - 1.0;
    }

    private static DailyAggregate fill(DailyAggregate aggregate, BucketStats stats) {
        aggregate.setCount(stats.count());
        aggregate.setMeanCount(stats.meanCount());
        aggregate.setMeanPolarity(stats.meanPolarity());
        aggregate.setStddevPolarity(stats.stddevPolarity());
        aggregate.setPositiveCount(stats.positiveCount());
        aggregate.setNeutralCount(stats.neutralCount());
        aggregate.setNegativeCount(stats.negativeCount());
        aggregate.setLowConfidenceCount(stats.lowConfidenceCount());
        aggregate.setFallbackCount(stats.fallbackCount());
        return aggregate;
    }

    private void checkIntegrity(String titleId, String source, LocalDate date) {
        if (!titles.contains(titleId)) {
            throw new AggregationIntegrityException("Title not in registry: " + titleId);
        }
        if (!Sources.isValid(source)) {
            throw new AggregationIntegrityException("Invalid source tag: " + source);
        }
        if (date == null) {
            throw new AggregationIntegrityException("Bucket date is required");
        }
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate oldest = today.minusDays(settings.getRetentionDays());
        if (date.isAfter(today) || date.isBefore(oldest)) {
            throw new AggregationIntegrityException("Bucket date " + date + " outside retention window ["
                    + oldest + ", " + today + "]");
        }
    }

    private Set<String> defaultSources(String titleId, LocalDate from, LocalDate to) {
        Set<String> sources = new LinkedHashSet<>(settings.getPlatforms());
        if (titles.contains(titleId)) {
            Instant start = from.atStartOfDay(ZoneOffset.UTC).toInstant();
            Instant end = to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            store.getScores(titleId, start, end).stream()
                    .map(SentimentScore::getSource)
                    .sorted()
                    .forEach(sources::add);
        }
        sources.add(Sources.SOCIAL);
        sources.add(Sources.SURVEY);
        return sources;
    }

    private void evictDashboardCaches() {
        for (String name : DASHBOARD_CACHES) {
            Cache cache = cacheManager.getCache(name);
            if (cache != null) cache.clear();
        }
    }

    private static String describe(AggregateId key) {
        return key.getTitleId() + "/" + key.getSource() + "/" + key.getDate();
    }
}
