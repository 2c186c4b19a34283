package quest.gekko.pulse.service.scoring;

import java.util.List;

/**
 * Access to a loaded text-classification model.
 */
public interface TransformerClient {
    String modelName();

    /**
     * Classifies each text, returning the label distribution per input, in input order.
     *
     * @throws quest.gekko.pulse.exception.ScoringFailureException on load failure, timeout or a bad response
     */
    List<List<LabelScore>> classify(List<String> texts);
}
