package quest.gekko.pulse.web.dto;

import quest.gekko.pulse.service.ingest.RawContent;

import java.time.Instant;

public record RawContentDTO(String source,
                            String externalId,
                            String title,
                            String text,
                            String author,
                            Instant createdAt,
                            Long engagement) {

    public RawContent toRawContent() {
        return new RawContent(source, externalId, title, text, author, createdAt, engagement);
    }
}
