package quest.gekko.pulse.service.ingest;

import quest.gekko.pulse.domain.Title;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The fixed set of tracked titles. Immutable after construction and shared by all workers.
 */
public final class TitleRegistry {

    private record Entry(Title title, Pattern matcher) {}

    private final Map<String, Entry> byId;

    public TitleRegistry(Collection<Title> titles) {
        Map<String, Entry> map = new LinkedHashMap<>();
        for (Title t : titles) {
            map.put(t.id(), new Entry(t, compile(t)));
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    // keywords match on whole words only, "dark" must not hit "darkness"
    private static Pattern compile(Title title) {
        String alternatives = title.keywords().stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternatives + ")(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public List<Title> all() {
        List<Title> titles = new ArrayList<>(byId.size());
        byId.values().forEach(e -> titles.add(e.title()));
        return titles;
    }

    public List<String> ids() {
        return List.copyOf(byId.keySet());
    }

    public boolean contains(String titleId) {
        return titleId != null && byId.containsKey(titleId);
    }

    public Optional<Title> get(String titleId) {
        return Optional.ofNullable(titleId == null ? null : byId.get(titleId)).map(Entry::title);
    }

    /** Looks a title up by id or by display name, ignoring case. */
    public Optional<Title> find(String idOrName) {
        if (idOrName == null || idOrName.isBlank()) return Optional.empty();
        String key = idOrName.trim();
        Entry direct = byId.get(key);
        if (direct != null) return Optional.of(direct.title());
        String lower = key.toLowerCase(Locale.ROOT);
        return byId.values().stream()
                .map(Entry::title)
                .filter(t -> t.id().equalsIgnoreCase(key) || t.name().toLowerCase(Locale.ROOT).equals(lower))
                .findFirst();
    }

    /**
     * Resolves the title a text is about. The hint wins when its title also matches the text;
     * otherwise the first matching title in registry order.
     */
    public Optional<Title> match(String text, String hint) {
        if (text == null || text.isBlank()) return Optional.empty();
        Optional<Title> hinted = find(hint);
        if (hinted.isPresent() && byId.get(hinted.get().id()).matcher().matcher(text).find()) {
            return hinted;
        }
        return byId.values().stream()
                .filter(e -> e.matcher().matcher(text).find())
                .map(Entry::title)
                .findFirst();
    }
}
