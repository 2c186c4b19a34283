package quest.gekko.pulse.service.query;

import java.time.LocalDate;
import java.util.Map;

/**
 * Rollup of a title's stored daily aggregates over the last {@code days} days, one entry per
 * platform tag plus {@code social}, and the survey side.
 */
public record TitleSummary(String titleId,
                           LocalDate from,
                           LocalDate to,
                           int days,
                           Map<String, PlatformSummary> platforms,
                           SurveySummary survey) {

    /**
     * {@code avgSentiment} is the mean over every row that fed a daily mean; null when no day
     * in the range has one.
     */
    public record PlatformSummary(Double avgSentiment,
                                  int totalCount,
                                  int positive,
                                  int neutral,
                                  int negative) {}

    public record SurveySummary(Double avgSatisfaction,
                                Double recommendationRate,
                                int totalCount) {}
}
