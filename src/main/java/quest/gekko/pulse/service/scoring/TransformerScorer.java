package quest.gekko.pulse.service.scoring;

import lombok.RequiredArgsConstructor;
import quest.gekko.pulse.domain.SentimentModel;
import quest.gekko.pulse.exception.ScoringFailureException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores through a transformer classifier. Over-long input is cut to the first
 * {@code maxTokens} whitespace tokens, so the same text always sends the same request.
 */
@RequiredArgsConstructor
public class TransformerScorer implements SentimentScorer {
    private final TransformerClient client;
    private final int maxTokens;

    @Override
    public SentimentModel model() {
        return SentimentModel.TRANSFORMER;
    }

    @Override
    public Polarity score(String text) {
        return scoreBatch(List.of(text)).get(0);
    }

    @Override
    public List<Polarity> scoreBatch(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        List<String> inputs = texts.stream().map(t -> truncate(t, maxTokens)).toList();
        List<List<LabelScore>> results = client.classify(inputs);
        if (results == null || results.size() != inputs.size()) {
            throw new ScoringFailureException("Model " + client.modelName() + " returned "
                    + (results == null ? "nothing" : results.size() + " results") + " for " + inputs.size() + " texts");
        }
        List<Polarity> polarities = new ArrayList<>(results.size());
        for (List<LabelScore> labels : results) {
            polarities.add(toPolarity(labels));
        }
        return polarities;
    }

    static Polarity toPolarity(List<LabelScore> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new ScoringFailureException("Empty label distribution");
        }
        // ties broken by label so the pick never depends on response order
        LabelScore best = labels.stream()
                .max(Comparator.comparingDouble(LabelScore::score)
                        .thenComparing(LabelScore::label, Comparator.reverseOrder()))
                .orElseThrow();
        double confidence = Math.max(0.0, Math.min(1.0, best.score()));
        String label = best.label() == null ? "" : best.label().toUpperCase(Locale.ROOT);
        return switch (label) {
            case "POSITIVE", "POS", "LABEL_1" -> new Polarity(confidence, confidence);
            case "NEGATIVE", "NEG", "LABEL_0" -> new Polarity(-confidence, confidence);
            default -> new Polarity(0.0, confidence);
        };
    }

    static String truncate(String text, int maxTokens) {
        if (text == null) return "";
        String[] tokens = text.strip().split("\\s+");
        if (tokens.length <= maxTokens) return text;
        return String.join(" ", Arrays.copyOf(tokens, maxTokens));
    }
}
