package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One score per (item, model). {@code model} is the model that produced the polarity,
 * {@code requestedModel} the one the run asked for; they differ after a fallback.
 */
@Entity
@Table(name = "sentiment_score", indexes = @Index(name = "idx_score_title_created", columnList = "title_id, content_created_at"))
@IdClass(ScoreId.class)
@Getter @Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SentimentScore {
    @Id @Column(name = "item_id", length = 64)
    String itemId;

    @Id @Enumerated(EnumType.STRING) @Column(length = 16)
    SentimentModel model;

    @Enumerated(EnumType.STRING) @Column(name = "requested_model", nullable = false, length = 16)
    SentimentModel requestedModel;

    @Column(nullable = false)
    double polarity;

    @Column(nullable = false)
    double confidence;

    @Column(name = "computed_at", nullable = false)
    Instant computedAt;

    @Column(name = "title_id", nullable = false)
    String titleId;

    @Column(nullable = false, length = 32)
    String source;

    @Column(name = "content_created_at", nullable = false)
    Instant contentCreatedAt;

    public boolean isFallback() {
        return requestedModel != null && requestedModel != model;
    }
}
