package quest.gekko.pulse.service.ingest;

import quest.gekko.pulse.domain.ContentItem;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one ingest pass. {@code items} holds every accepted item once, as stored;
 * {@code storeFailures} counts accepted items the store refused.
 */
public record IngestOutcome(List<ContentItem> items,
                            int received,
                            int created,
                            int merged,
                            Map<RejectionReason, Integer> rejected,
                            int storeFailures) {

    public IngestOutcome {
        items = List.copyOf(items);
        EnumMap<RejectionReason, Integer> copy = new EnumMap<>(RejectionReason.class);
        copy.putAll(rejected);
        rejected = Collections.unmodifiableMap(copy);
    }

    public int rejectedTotal() {
        return rejected.values().stream().mapToInt(Integer::intValue).sum();
    }
}
