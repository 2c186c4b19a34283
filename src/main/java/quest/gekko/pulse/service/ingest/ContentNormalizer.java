package quest.gekko.pulse.service.ingest;

import lombok.RequiredArgsConstructor;
import quest.gekko.pulse.domain.ContentItem;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.domain.Title;
import quest.gekko.pulse.util.Fingerprint;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw records into canonical {@link ContentItem}s. Pure: the same raw record always
 * yields the same item id, and nothing is persisted here.
 *
 * The id is taken over the full cleaned text; text, author and external id are then clipped
 * to their column widths, so long Reddit self-posts are stored with a stable prefix.
 */
@RequiredArgsConstructor
public class ContentNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TitleRegistry titles;

    public NormalizationResult normalize(RawContent raw) {
        if (raw == null || raw.createdAt() == null || !Sources.isPlatform(Sources.normalize(raw.source()))) {
            return NormalizationResult.rejected(RejectionReason.MALFORMED);
        }
        String text = clean(raw.text());
        if (text.isEmpty()) {
            return NormalizationResult.rejected(RejectionReason.EMPTY_TEXT);
        }
        Optional<Title> title = titles.match(text, raw.titleHint());
        if (title.isEmpty()) {
            return NormalizationResult.rejected(RejectionReason.NO_TITLE_MATCH);
        }

        String source = Sources.normalize(raw.source());
        String externalId = raw.externalId() == null || raw.externalId().isBlank() ? null : raw.externalId().trim();
        String author = raw.author() == null ? null : raw.author().trim();
        String id = externalId != null
                ? Fingerprint.ofExternal(source, externalId)
                : Fingerprint.ofContent(source, author, text, raw.createdAt());

        return NormalizationResult.accepted(ContentItem.builder()
                .id(id)
                .source(source)
                .externalId(clip(externalId, ContentItem.MAX_EXTERNAL_ID_LENGTH))
                .titleId(title.get().id())
                .text(clip(text, ContentItem.MAX_TEXT_LENGTH))
                .author(clip(author, ContentItem.MAX_AUTHOR_LENGTH))
                .createdAt(raw.createdAt())
                .engagement(raw.engagement())
                .build());
    }

    /**
     * Folds a re-ingested copy into the stored item: engagement is last-write-wins,
     * everything else (creation time in particular) stays as first written.
     */
    public ContentItem merge(ContentItem existing, ContentItem incoming, Instant now) {
        ContentItem.ContentItemBuilder merged = existing.toBuilder().updatedAt(now);
        if (incoming.getEngagement() != null) {
            merged.engagement(incoming.getEngagement());
        }
        return merged.build();
    }

    static String clip(String value, int max) {
        if (value == null || value.length() <= max) return value;
        int end = Character.isHighSurrogate(value.charAt(max - 1)) ? max - 1 : max;
        return value.substring(0, end);
    }

    static String clean(String text) {
        return text == null ? "" : WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }
}
