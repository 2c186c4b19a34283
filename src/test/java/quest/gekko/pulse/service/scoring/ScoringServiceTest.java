package quest.gekko.pulse.service.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.domain.SentimentScore;
import quest.gekko.pulse.exception.ScoringFailureException;
import quest.gekko.pulse.service.store.InMemoryPipelineStore;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static quest.gekko.pulse.Fixtures.CLOCK;
import static quest.gekko.pulse.Fixtures.item;
import static quest.gekko.pulse.Fixtures.score;
import static quest.gekko.pulse.Fixtures.settings;

class ScoringServiceTest {

    private static final Instant AT = Instant.parse("2024-01-05T10:00:00Z");

    private InMemoryPipelineStore store;
    private TransformerClient client;
    private LexiconScorer lexicon;
    private List<ContentItem> items;

    @BeforeEach
    void setUp() {
        store = new InMemoryPipelineStore();
        client = mock(TransformerClient.class);
        when(client.modelName()).thenReturn("sst2");
        lexicon = new LexiconScorer(SentimentLexicon.of(Map.of("love", 3.2, "hate", -2.7)));
        items = List.of(
                item("a", "wednesday", "twitter", "love Wednesday", AT),
                item("b", "wednesday", "twitter", "hate Wednesday", AT.plusSeconds(1)),
                item("c", "wednesday", "reddit", "Wednesday tonight", AT.plusSeconds(2)));
        items.forEach(store::putItem);
    }

    private ScoringService service(PipelineSettings settings) {
        Map<SentimentModel, SentimentScorer> scorers = Map.of(
                SentimentModel.LEXICON, lexicon,
                SentimentModel.TRANSFORMER, new TransformerScorer(client, 512));
        return new ScoringService(store, scorers, settings, Runnable::run, Runnable::run, CLOCK);
    }

    @Test
    void lexiconScoresEveryItemOnce() {
        ScoringService scoring = service(settings());

        ScoringOutcome first = scoring.scoreBatch(items, SentimentModel.LEXICON);
        ScoringOutcome second = scoring.scoreBatch(items, SentimentModel.LEXICON);

        assertThat(first.scored(SentimentModel.LEXICON)).isEqualTo(3);
        assertThat(second.totalScored()).isZero();
        assertThat(second.skipped()).isEqualTo(3);
        assertThat(store.getScore("a", SentimentModel.LEXICON).orElseThrow().getPolarity()).isPositive();
        assertThat(store.getScore("b", SentimentModel.LEXICON).orElseThrow().getPolarity()).isNegative();
    }

    @Test
    void failedTransformerBatchFallsBackToLexicon() {
        when(client.classify(anyList()))
                .thenThrow(new ScoringFailureException("model not loaded"))
                .thenReturn(List.of(List.of(new LabelScore("NEGATIVE", 0.9))));
        ScoringService scoring = service(settings().toBuilder().batchSize(2).build());

        ScoringOutcome outcome = scoring.scoreBatch(items, SentimentModel.TRANSFORMER);

        assertThat(outcome.failures()).isEqualTo(2);
        assertThat(outcome.fallbacks()).isEqualTo(2);
        assertThat(outcome.scored(SentimentModel.LEXICON)).isEqualTo(2);
        assertThat(outcome.scored(SentimentModel.TRANSFORMER)).isEqualTo(1);
        assertThat(outcome.deferred()).isZero();

        SentimentScore fallback = store.getScore("a", SentimentModel.LEXICON).orElseThrow();
        assertThat(fallback.getRequestedModel()).isEqualTo(SentimentModel.TRANSFORMER);
        assertThat(fallback.isFallback()).isTrue();
        assertThat(store.getScore("c", SentimentModel.TRANSFORMER).orElseThrow().getPolarity()).isEqualTo(-0.9);
    }

    @Test
    void timedOutBatchIsDeferredWithoutRows() {
        when(client.classify(anyList())).thenThrow(new ScoringFailureException("slow", null, true));
        ScoringService scoring = service(settings());

        ScoringOutcome outcome = scoring.scoreBatch(items, SentimentModel.TRANSFORMER);

        assertThat(outcome.deferred()).isEqualTo(3);
        assertThat(outcome.failures()).isEqualTo(3);
        assertThat(outcome.fallbacks()).isZero();
        assertThat(store.getScore("a", SentimentModel.LEXICON)).isEmpty();
        assertThat(store.getScore("a", SentimentModel.TRANSFORMER)).isEmpty();
    }

    @Test
    void timeoutFallsBackWhenConfigured() {
        when(client.classify(anyList())).thenThrow(new ScoringFailureException("slow", null, true));
        ScoringService scoring = service(settings().toBuilder().fallbackOnTimeout(true).build());

        ScoringOutcome outcome = scoring.scoreBatch(items, SentimentModel.TRANSFORMER);

        assertThat(outcome.fallbacks()).isEqualTo(3);
        assertThat(outcome.deferred()).isZero();
    }

    @Test
    void rescoreOverwritesWithTheSameResult() {
        ScoringService scoring = service(settings());
        store.putScore(score(items.get(0), SentimentModel.LEXICON, -1.0, 0.2));

        ScoringOutcome outcome = scoring.rescore(items, SentimentModel.LEXICON);
        double once = store.getScore("a", SentimentModel.LEXICON).orElseThrow().getPolarity();
        scoring.rescore(items, SentimentModel.LEXICON);

        assertThat(outcome.scored(SentimentModel.LEXICON)).isEqualTo(3);
        assertThat(once).isPositive();
        assertThat(store.getScore("a", SentimentModel.LEXICON).orElseThrow().getPolarity()).isEqualTo(once);
        assertThat(store.getScore("a", SentimentModel.LEXICON).orElseThrow().getConfidence()).isEqualTo(1.0);
    }

    @Test
    void alreadyScoredItemsNeverReachTheModel() {
        items.forEach(i -> store.putScore(score(i, SentimentModel.TRANSFORMER, 0.5, 0.9)));
        ScoringService scoring = service(settings());

        ScoringOutcome outcome = scoring.scoreBatch(items, SentimentModel.TRANSFORMER);

        assertThat(outcome.skipped()).isEqualTo(3);
        verify(client, never()).classify(anyList());
    }

    @Test
    void partitionKeepsOrder() {
        assertThat(ScoringService.partition(List.of(1, 2, 3, 4, 5), 2))
                .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }
}
