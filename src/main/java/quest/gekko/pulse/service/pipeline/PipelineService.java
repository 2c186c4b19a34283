package quest.gekko.pulse.service.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.AggregateId;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.exception.UnknownTitleException;
import quest.gekko.pulse.service.aggregation.AggregationService;
import quest.gekko.pulse.service.ingest.ContentCollector;
import quest.gekko.pulse.service.ingest.IngestOutcome;
import quest.gekko.pulse.service.ingest.IngestionService;
import quest.gekko.pulse.service.ingest.RawContent;
import quest.gekko.pulse.service.ingest.TitleRegistry;
import quest.gekko.pulse.service.scoring.ScoringService;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Entry points for every pipeline stage. Each operation takes explicit inputs, can be
 * invoked any number of times and returns a {@link RunSummary}; whoever schedules them
 * holds no pipeline logic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineService {
    static final int BACKLOG_LIMIT = 10_000;

    private final IngestionService ingestion;
    private final ScoringService scoring;
    private final AggregationService aggregation;
    private final PipelineStore store;
    private final TitleRegistry titles;
    private final PipelineSettings settings;
    private final ObjectProvider<ContentCollector> collectors;
    private final Clock clock;

    /**
     * Ingests the records, scores every item of the days they touch with the configured model
     * and recomputes those days' buckets.
     */
    public RunSummary run(List<RawContent> raws) {
        return run(raws, new RunSummary("run", clock.instant()));
    }

    /** Drains every registered collector, then behaves like {@link #run(List)}. None registered is an empty run. */
    public RunSummary runCollectors() {
        RunSummary summary = new RunSummary("collect", clock.instant());
        List<RawContent> raws = new ArrayList<>();
        for (ContentCollector collector : collectors.orderedStream().toList()) {
            try (Stream<RawContent> stream = collector.collect()) {
                stream.forEach(raws::add);
            } catch (RuntimeException e) {
                log.error("Collector {} failed, continuing without it", collector.source(), e);
                summary.collectorFailed(collector.source(), e.getMessage());
            }
        }
        return run(raws, summary);
    }

    private RunSummary run(List<RawContent> raws, RunSummary summary) {
        IngestOutcome ingest = ingestion.ingest(raws);
        summary.add(ingest);
        SentimentModel model = settings.getSentimentModel();

        Map<TitleDay, Set<String>> touched = new LinkedHashMap<>();
        ingest.items().forEach(item -> touch(touched, item));
        // items deferred by earlier runs
        List<ContentItem> backlog = store.unscoredItems(model, BACKLOG_LIMIT);
        backlog.forEach(item -> touch(touched, item));

        List<ContentItem> toScore = new ArrayList<>(backlog);
        touched.keySet().forEach(td -> toScore.addAll(itemsOf(td.titleId(), td.day(), td.day())));
        summary.add(scoring.scoreBatch(toScore, model));

        List<AggregateId> buckets = new ArrayList<>();
        touched.forEach((td, sources) -> {
            sources.forEach(s -> buckets.add(new AggregateId(td.titleId(), s, td.day())));
            buckets.add(new AggregateId(td.titleId(), Sources.SOCIAL, td.day()));
            buckets.add(new AggregateId(td.titleId(), Sources.SURVEY, td.day()));
        });
        summary.add(aggregation.aggregateAll(buckets));

        return finish(summary);
    }

    /**
     * Scores up to {@code limit} of the oldest items without a row for {@code model} and
     * recomputes the buckets they belong to.
     */
    public RunSummary scorePending(SentimentModel model, int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be positive");
        RunSummary summary = new RunSummary("score-pending", clock.instant());
        SentimentModel m = model == null ? settings.getSentimentModel() : model;
        List<ContentItem> pending = store.unscoredItems(m, limit);
        summary.add(scoring.scoreBatch(pending, m));

        Map<TitleDay, Set<String>> touched = new LinkedHashMap<>();
        pending.forEach(item -> touch(touched, item));
        List<AggregateId> buckets = new ArrayList<>();
        touched.forEach((td, sources) -> {
            sources.forEach(s -> buckets.add(new AggregateId(td.titleId(), s, td.day())));
            buckets.add(new AggregateId(td.titleId(), Sources.SOCIAL, td.day()));
        });
        summary.add(aggregation.aggregateAll(buckets));
        return finish(summary);
    }

    private static void touch(Map<TitleDay, Set<String>> touched, ContentItem item) {
        touched.computeIfAbsent(new TitleDay(item.getTitleId(), day(item.getCreatedAt())), k -> new LinkedHashSet<>())
                .add(item.getSource());
    }

    /** Scores items created within the days given that have no row for {@code model} yet. */
    public RunSummary score(LocalDate from, LocalDate to, Collection<String> titleIds, SentimentModel model) {
        RunSummary summary = new RunSummary("score", clock.instant());
        SentimentModel m = model == null ? settings.getSentimentModel() : model;
        summary.add(scoring.scoreBatch(items(from, to, titleIds), m));
        return finish(summary);
    }

    /** Scores items again with {@code model}, overwriting their rows. Aggregates are not touched. */
    public RunSummary rescore(LocalDate from, LocalDate to, Collection<String> titleIds, SentimentModel model) {
        RunSummary summary = new RunSummary("rescore", clock.instant());
        SentimentModel m = model == null ? settings.getSentimentModel() : model;
        summary.add(scoring.rescore(items(from, to, titleIds), m));
        return finish(summary);
    }

    /** Recomputes every bucket of the titles and days given. */
    public RunSummary aggregate(LocalDate from, LocalDate to, Collection<String> titleIds, Collection<String> sources) {
        RunSummary summary = new RunSummary("aggregate", clock.instant());
        checkRange(from, to);
        summary.add(aggregation.aggregateRange(resolveTitles(titleIds), sources, from, to));
        return finish(summary);
    }

    private List<ContentItem> items(LocalDate from, LocalDate to, Collection<String> titleIds) {
        checkRange(from, to);
        List<ContentItem> items = new ArrayList<>();
        for (String titleId : resolveTitles(titleIds)) {
            items.addAll(itemsOf(titleId, from, to));
        }
        return items;
    }

    private List<ContentItem> itemsOf(String titleId, LocalDate from, LocalDate to) {
        Instant start = from.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return store.getItems(titleId, start, end);
    }

    private List<String> resolveTitles(Collection<String> titleIds) {
        if (titleIds == null || titleIds.isEmpty()) return titles.ids();
        for (String id : titleIds) {
            if (!titles.contains(id)) throw new UnknownTitleException(id);
        }
        return List.copyOf(titleIds);
    }

    private static void checkRange(LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("Invalid date range: " + from + " .. " + to);
        }
    }

    private RunSummary finish(RunSummary summary) {
        summary.finish(clock.instant());
        if (summary.isFailed()) {
            log.error("Pipeline {}", summary);
        } else {
            log.info("Pipeline {}", summary);
        }
        return summary;
    }

    private static LocalDate day(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    private record TitleDay(String titleId, LocalDate day) {}
}
