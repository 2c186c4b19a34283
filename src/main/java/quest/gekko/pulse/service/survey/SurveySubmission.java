package quest.gekko.pulse.service.survey;

import java.time.Instant;

/**
 * One survey answer as received. {@code title} may be a title id or its display name.
 */
public record SurveySubmission(String respondentId,
                               String title,
                               Integer satisfaction,
                               Instant submittedAt,
                               Boolean wouldRecommend,
                               Double completionRate) {
}
