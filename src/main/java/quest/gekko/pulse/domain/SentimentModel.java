package quest.gekko.pulse.domain;

import quest.gekko.pulse.exception.PipelineConfigurationException;

import java.util.Locale;

public enum SentimentModel {
    LEXICON,
    TRANSFORMER;

    /** Accepts the enum name in any case plus the legacy aliases "vader" and "transformers". */
    public static SentimentModel parse(String name) {
        if (name == null || name.isBlank()) {
            throw new PipelineConfigurationException("Sentiment model must not be blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "lexicon", "vader" -> LEXICON;
            case "transformer", "transformers" -> TRANSFORMER;
            default -> throw new PipelineConfigurationException("Unknown sentiment model: " + name);
        };
    }
}
