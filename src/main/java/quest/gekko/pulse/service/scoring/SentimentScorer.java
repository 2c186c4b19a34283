package quest.gekko.pulse.service.scoring;

import quest.gekko.pulse.domain.SentimentModel;

import java.util.List;

/**
 * One implementation per model family. Implementations are deterministic for a given
 * configuration and safe to share between worker threads.
 */
public interface SentimentScorer {
    SentimentModel model();

    Polarity score(String text);

    /**
     * Scores texts in order; the result has the same size as the input.
     *
     * @throws quest.gekko.pulse.exception.ScoringFailureException when the model cannot score the batch
     */
    default List<Polarity> scoreBatch(List<String> texts) {
        return texts.stream().map(this::score).toList();
    }
}
