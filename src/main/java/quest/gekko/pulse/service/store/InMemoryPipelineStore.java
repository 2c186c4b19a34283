package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.AggregateId;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.domain.ScoreId;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.SentimentScore;
import quest.gekko.pulse.domain.SurveyResponse;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link PipelineStore}.
 * Intended for local runs and tests only (single JVM, nothing survives a restart).
 */
public final class InMemoryPipelineStore implements PipelineStore {

    private record ResponseKey(String respondentId, String titleId) {}

    private final ConcurrentMap<String, ContentItem> items = new ConcurrentHashMap<>();
    private final ConcurrentMap<ScoreId, SentimentScore> scores = new ConcurrentHashMap<>();
    private final ConcurrentMap<ResponseKey, SurveyResponse> responses = new ConcurrentHashMap<>();
    private final ConcurrentMap<AggregateId, DailyAggregate> aggregates = new ConcurrentHashMap<>();
    private final AtomicLong responseIds = new AtomicLong();

    private static boolean within(Instant at, Instant from, Instant to) {
        return !at.isBefore(from) && at.isBefore(to);
    }

    @Override
    public Optional<ContentItem> getItem(String id) {
        return Optional.ofNullable(items.get(id)).map(i -> i.toBuilder().build());
    }

    @Override
    public ContentItem putItem(ContentItem item) {
        items.put(item.getId(), item.toBuilder().build());
        return item;
    }

    @Override
    public List<ContentItem> getItems(String titleId, Instant from, Instant to) {
        return items.values().stream()
                .filter(i -> i.getTitleId().equals(titleId) && within(i.getCreatedAt(), from, to))
                .sorted(Comparator.comparing(ContentItem::getCreatedAt).thenComparing(ContentItem::getId))
                .map(i -> i.toBuilder().build())
                .toList();
    }

    @Override
    public List<ContentItem> unscoredItems(SentimentModel model, int limit) {
        return items.values().stream()
                .filter(i -> !scores.containsKey(new ScoreId(i.getId(), model)))
                .sorted(Comparator.comparing(ContentItem::getCreatedAt).thenComparing(ContentItem::getId))
                .limit(limit)
                .map(i -> i.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<SentimentScore> getScore(String itemId, SentimentModel model) {
        return Optional.ofNullable(scores.get(new ScoreId(itemId, model))).map(s -> s.toBuilder().build());
    }

    @Override
    public SentimentScore putScore(SentimentScore score) {
        scores.put(new ScoreId(score.getItemId(), score.getModel()), score.toBuilder().build());
        return score;
    }

    @Override
    public List<SentimentScore> getScores(String titleId, Instant from, Instant to) {
        return scores.values().stream()
                .filter(s -> s.getTitleId().equals(titleId) && within(s.getContentCreatedAt(), from, to))
                .sorted(Comparator.comparing(SentimentScore::getItemId).thenComparing(SentimentScore::getModel))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<SurveyResponse> getResponse(String respondentId, String titleId) {
        return Optional.ofNullable(responses.get(new ResponseKey(respondentId, titleId)));
    }

    @Override
    public SurveyResponse putResponse(SurveyResponse response) {
        SurveyResponse stored = response.getId() != null ? response
                : response.toBuilder().id(responseIds.incrementAndGet()).build();
        responses.put(new ResponseKey(stored.getRespondentId(), stored.getTitleId()), stored);
        return stored;
    }

    @Override
    public List<SurveyResponse> getResponses(String titleId, Instant from, Instant to) {
        return responses.values().stream()
                .filter(r -> r.getTitleId().equals(titleId) && within(r.getSubmittedAt(), from, to))
                .sorted(Comparator.comparing(SurveyResponse::getRespondentId))
                .toList();
    }

    @Override
    public DailyAggregate putAggregate(DailyAggregate aggregate) {
        aggregates.put(new AggregateId(aggregate.getTitleId(), aggregate.getSource(), aggregate.getDate()),
                aggregate.toBuilder().build());
        return aggregate;
    }

    @Override
    public Optional<DailyAggregate> getAggregate(String titleId, String source, LocalDate date) {
        return Optional.ofNullable(aggregates.get(new AggregateId(titleId, source, date)))
                .map(a -> a.toBuilder().build());
    }

    @Override
    public List<DailyAggregate> getAggregates(String titleId, String source, LocalDate from, LocalDate to) {
        return aggregates.values().stream()
                .filter(a -> a.getTitleId().equals(titleId) && a.getSource().equals(source)
                        && !a.getDate().isBefore(from) && !a.getDate().isAfter(to))
                .sorted(Comparator.comparing(DailyAggregate::getDate))
                .map(a -> a.toBuilder().build())
                .toList();
    }
}
