package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Immutable once stored, hence no setters. */
@Entity
@Table(name = "survey_response",
        uniqueConstraints = @UniqueConstraint(columnNames = { "respondent_id", "title_id" }),
        indexes = @Index(name = "idx_survey_title_submitted", columnList = "title_id, submitted_at"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SurveyResponse {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "respondent_id", nullable = false, length = 100)
    String respondentId;

    @Column(name = "title_id", nullable = false)
    String titleId;

    @Column(nullable = false)
    int satisfaction;

    Boolean wouldRecommend;

    Double completionRate;

    @Column(name = "submitted_at", nullable = false)
    Instant submittedAt;
}
