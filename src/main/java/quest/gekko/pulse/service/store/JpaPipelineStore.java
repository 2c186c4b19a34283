package quest.gekko.pulse.service.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pulse.domain.AggregateId;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.domain.ScoreId;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.SentimentScore;
import quest.gekko.pulse.domain.SurveyResponse;
import quest.gekko.pulse.repository.ContentItemRepository;
import quest.gekko.pulse.repository.DailyAggregateRepository;
import quest.gekko.pulse.repository.SentimentScoreRepository;
import quest.gekko.pulse.repository.SurveyResponseRepository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * {@link PipelineStore} over Spring Data JPA. Every call is its own transaction, bounded by
 * {@code spring.transaction.default-timeout}. Selected with {@code pulse.store=jpa} (the default).
 */
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaPipelineStore implements PipelineStore {
    private final ContentItemRepository itemRepository;
    private final SentimentScoreRepository scoreRepository;
    private final SurveyResponseRepository responseRepository;
    private final DailyAggregateRepository aggregateRepository;

    @Override
    public Optional<ContentItem> getItem(String id) {
        return itemRepository.findById(id);
    }

    @Override
    @Transactional
    public ContentItem putItem(ContentItem item) {
        return itemRepository.save(item);
    }

    @Override
    public List<ContentItem> getItems(String titleId, Instant from, Instant to) {
        return itemRepository.findForTitle(titleId, from, to);
    }

    @Override
    public List<ContentItem> unscoredItems(SentimentModel model, int limit) {
        return itemRepository.findUnscored(model, PageRequest.of(0, limit));
    }

    @Override
    public Optional<SentimentScore> getScore(String itemId, SentimentModel model) {
        return scoreRepository.findById(new ScoreId(itemId, model));
    }

    @Override
    @Transactional
    public SentimentScore putScore(SentimentScore score) {
        return scoreRepository.save(score);
    }

    @Override
    public List<SentimentScore> getScores(String titleId, Instant from, Instant to) {
        return scoreRepository.findForTitle(titleId, from, to);
    }

    @Override
    public Optional<SurveyResponse> getResponse(String respondentId, String titleId) {
        return responseRepository.findByRespondentIdAndTitleId(respondentId, titleId);
    }

    @Override
    @Transactional
    public SurveyResponse putResponse(SurveyResponse response) {
        return responseRepository.save(response);
    }

    @Override
    public List<SurveyResponse> getResponses(String titleId, Instant from, Instant to) {
        return responseRepository.findForTitle(titleId, from, to);
    }

    @Override
    @Transactional
    public DailyAggregate putAggregate(DailyAggregate aggregate) {
        return aggregateRepository.save(aggregate);
    }

    @Override
    public Optional<DailyAggregate> getAggregate(String titleId, String source, LocalDate date) {
        return aggregateRepository.findById(new AggregateId(titleId, source, date));
    }

    @Override
    public List<DailyAggregate> getAggregates(String titleId, String source, LocalDate from, LocalDate to) {
        return aggregateRepository.findRange(titleId, source, from, to);
    }
}
