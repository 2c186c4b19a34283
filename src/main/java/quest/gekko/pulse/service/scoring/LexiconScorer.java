package quest.gekko.pulse.service.scoring;

import lombok.RequiredArgsConstructor;
import quest.gekko.pulse.domain.SentimentModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule based scorer in the VADER manner: word valences adjusted for boosters, negation,
 * capitalisation, "but" clauses and exclamation marks, squashed into [-1, 1].
 * Never fails; text without scorable words is neutral.
 */
@RequiredArgsConstructor
public class LexiconScorer implements SentimentScorer {
    static final double CAPS_INCREMENT = 0.733;
    static final double NEGATION_SCALAR = -0.74;
    static final double EXCLAMATION_INCREMENT = 0.292;
    static final double NORMALIZATION_ALPHA = 15.0;

    private static final Pattern WORD = Pattern.compile("[\\p{L}][\\p{L}']*");

    private final SentimentLexicon lexicon;

    @Override
    public SentimentModel model() {
        return SentimentModel.LEXICON;
    }

    @Override
    public Polarity score(String text) {
        if (text == null || text.isBlank()) return Polarity.NEUTRAL;

        List<String> words = tokenize(text);
        boolean capsDiffer = capsDiffer(words);
        List<String> lower = words.stream().map(w -> w.toLowerCase(Locale.ROOT).replace("'", "")).toList();

        double[] valences = new double[words.size()];
        for (int i = 0; i < words.size(); i++) {
            valences[i] = valenceAt(i, words, lower, capsDiffer);
        }
        applyButClause(lower, valences);

        double sum = 0.0;
        for (double v : valences) sum += v;
        if (sum == 0.0) return Polarity.NEUTRAL;

        long bangs = Math.min(4, text.chars().filter(c -> c == '!').count());
        sum += Math.signum(sum) * bangs * EXCLAMATION_INCREMENT;

        double compound = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        compound = Math.max(-1.0, Math.min(1.0, compound));
        return new Polarity(Math.round(compound * 10_000d) / 10_000d, 1.0);
    }

    private double valenceAt(int i, List<String> words, List<String> lower, boolean capsDiffer) {
        String token = lower.get(i);
        if (SentimentLexicon.BOOSTERS.containsKey(token)) return 0.0;
        Double base = lexicon.valence(token).orElse(null);
        if (base == null) return 0.0;

        double v = base;
        if (capsDiffer && isShouted(words.get(i))) {
            v += Math.signum(v) * CAPS_INCREMENT;
        }
        for (int back = 1; back <= 3 && i - back >= 0; back++) {
            String prev = lower.get(i - back);
            if (!lexicon.contains(prev)) {
                double boost = boosterScalar(prev, words.get(i - back), v, capsDiffer);
                if (back == 2) boost *= 0.95;
                if (back == 3) boost *= 0.9;
                v += boost;
            }
            if (isNegation(prev)) {
                v *= NEGATION_SCALAR;
            }
        }
        return v;
    }

    private static double boosterScalar(String token, String original, double valence, boolean capsDiffer) {
        Double scalar = SentimentLexicon.BOOSTERS.get(token);
        if (scalar == null) return 0.0;
        double s = valence < 0 ? -scalar : scalar;
        if (capsDiffer && isShouted(original)) {
            s += valence < 0 ? -CAPS_INCREMENT : CAPS_INCREMENT;
        }
        return s;
    }

    private static void applyButClause(List<String> lower, double[] valences) {
        int but = lower.indexOf("but");
        if (but < 0) return;
        for (int i = 0; i < valences.length; i++) {
            if (i < but) valences[i] *= 0.5;
            else if (i > but) valences[i] *= 1.5;
        }
    }

    static boolean isNegation(String token) {
        return SentimentLexicon.NEGATIONS.contains(token);
    }

    private static boolean isShouted(String word) {
        return word.length() > 1 && word.equals(word.toUpperCase(Locale.ROOT)) && !word.equals(word.toLowerCase(Locale.ROOT));
    }

    private static boolean capsDiffer(List<String> words) {
        long shouted = words.stream().filter(LexiconScorer::isShouted).count();
        return shouted > 0 && shouted < words.size();
    }

    static List<String> tokenize(String text) {
        List<String> words = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }
}
