package quest.gekko.pulse.domain;

import java.util.Set;

/**
 * A tracked entity. The display name always counts as one of the match keywords.
 */
public record Title(String id, String name, Set<String> keywords) {
    public Title {
        keywords = Set.copyOf(keywords);
    }
}
