package quest.gekko.pulse.service.ingest;

import quest.gekko.pulse.domain.ContentItem;

import java.util.Optional;

/**
 * Either a canonical item or the reason the raw record was dropped.
 */
public record NormalizationResult(ContentItem item, RejectionReason rejection) {

    public static NormalizationResult accepted(ContentItem item) {
        return new NormalizationResult(item, null);
    }

    public static NormalizationResult rejected(RejectionReason reason) {
        return new NormalizationResult(null, reason);
    }

    public boolean isAccepted() {
        return item != null;
    }

    public Optional<ContentItem> asItem() {
        return Optional.ofNullable(item);
    }
}
