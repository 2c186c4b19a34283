package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "content_item", indexes = @Index(name = "idx_item_title_created", columnList = "title_id, created_at"))
@Getter @Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContentItem {
    public static final int MAX_TEXT_LENGTH = 40_000;
    public static final int MAX_AUTHOR_LENGTH = 255;
    public static final int MAX_EXTERNAL_ID_LENGTH = 255;

    /** Content fingerprint, see {@link quest.gekko.pulse.util.Fingerprint}. */
    @Id @Column(length = 64)
    String id;

    @Column(nullable = false, length = 32)
    String source;

    @Column(name = "external_id", length = MAX_EXTERNAL_ID_LENGTH)
    String externalId;

    @Column(name = "title_id", nullable = false)
    String titleId;

    @Column(nullable = false, length = MAX_TEXT_LENGTH)
    String text;

    @Column(length = MAX_AUTHOR_LENGTH)
    String author;

    @Column(name = "created_at", nullable = false)
    Instant createdAt;

    Long engagement;

    Instant ingestedAt;
    Instant updatedAt;
}
