package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.SentimentScore;
import quest.gekko.pulse.domain.SurveyResponse;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Keyed storage for everything the pipeline reads and writes.
 *
 * Contracts:
 *  - All methods are thread-safe.
 *  - Instant ranges are half-open {@code [from, to)}; date ranges are inclusive.
 *  - {@code putScore} overwrites the row for the same (item, model).
 *  - {@code putAggregate} replaces the bucket wholesale; readers see the old or the new
 *    row, never a mix.
 *  - Returned entities are detached copies; mutating them does not touch the store.
 */
public interface PipelineStore {

    Optional<ContentItem> getItem(String id);

    ContentItem putItem(ContentItem item);

    List<ContentItem> getItems(String titleId, Instant from, Instant to);

    /** Oldest items first that have no row produced by {@code model}, at most {@code limit}. */
    List<ContentItem> unscoredItems(SentimentModel model, int limit);

    Optional<SentimentScore> getScore(String itemId, SentimentModel model);

    SentimentScore putScore(SentimentScore score);

    /** Every model's scores for items of the title created within the range. */
    List<SentimentScore> getScores(String titleId, Instant from, Instant to);

    Optional<SurveyResponse> getResponse(String respondentId, String titleId);

    SurveyResponse putResponse(SurveyResponse response);

    List<SurveyResponse> getResponses(String titleId, Instant from, Instant to);

    DailyAggregate putAggregate(DailyAggregate aggregate);

    Optional<DailyAggregate> getAggregate(String titleId, String source, LocalDate date);

    List<DailyAggregate> getAggregates(String titleId, String source, LocalDate from, LocalDate to);
}
