package quest.gekko.pulse.service.scoring;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Word valences in [-4, 4], read once from a tab separated resource and never modified.
 */
public final class SentimentLexicon {
    public static final String DEFAULT_RESOURCE = "lexicon/sentiment-lexicon.tsv";

    static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "none", "nobody", "nothing", "neither", "nor", "nowhere",
            "cannot", "without", "aint", "arent", "cant", "couldnt", "didnt", "doesnt", "dont",
            "hadnt", "hasnt", "havent", "isnt", "shouldnt", "wasnt", "werent", "wont", "wouldnt");

    static final Map<String, Double> BOOSTERS = Map.ofEntries(
            Map.entry("absolutely", 0.293), Map.entry("amazingly", 0.293), Map.entry("completely", 0.293),
            Map.entry("extremely", 0.293), Map.entry("incredibly", 0.293), Map.entry("really", 0.293),
            Map.entry("so", 0.293), Map.entry("totally", 0.293), Map.entry("very", 0.293),
            Map.entry("super", 0.293), Map.entry("truly", 0.293), Map.entry("utterly", 0.293),
            Map.entry("most", 0.293), Map.entry("more", 0.293), Map.entry("highly", 0.293),
            Map.entry("barely", -0.293), Map.entry("hardly", -0.293), Map.entry("slightly", -0.293),
            Map.entry("somewhat", -0.293), Map.entry("kinda", -0.293), Map.entry("less", -0.293),
            Map.entry("little", -0.293), Map.entry("marginally", -0.293), Map.entry("partly", -0.293));

    private final Map<String, Double> valences;

    private SentimentLexicon(Map<String, Double> valences) {
        this.valences = Map.copyOf(valences);
    }

    public static SentimentLexicon of(Map<String, Double> valences) {
        Map<String, Double> lower = new HashMap<>();
        valences.forEach((k, v) -> lower.put(k.toLowerCase(Locale.ROOT), v));
        return new SentimentLexicon(lower);
    }

    public static SentimentLexicon fromClasspath(String resource) {
        InputStream in = SentimentLexicon.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Lexicon resource not found: " + resource);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read lexicon " + resource, e);
        }
    }

    static SentimentLexicon parse(BufferedReader reader) throws IOException {
        Map<String, Double> map = new HashMap<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank() || line.startsWith("#")) continue;
            String[] parts = line.split("\t");
            if (parts.length < 2) {
                throw new IllegalStateException("Malformed lexicon line " + lineNo + ": " + line);
            }
            map.put(parts[0].trim().toLowerCase(Locale.ROOT), Double.parseDouble(parts[1].trim()));
        }
        return new SentimentLexicon(map);
    }

    public Optional<Double> valence(String token) {
        return Optional.ofNullable(valences.get(token));
    }

    public boolean contains(String token) {
        return valences.containsKey(token);
    }

    public int size() {
        return valences.size();
    }
}
