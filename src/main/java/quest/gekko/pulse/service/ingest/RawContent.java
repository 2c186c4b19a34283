package quest.gekko.pulse.service.ingest;

import java.time.Instant;

/**
 * A record as handed over by a collector. {@code titleHint} is advisory only.
 */
public record RawContent(
        String source,
        String externalId,
        String titleHint,
        String text,
        String author,
        Instant createdAt,
        Long engagement) {
}
