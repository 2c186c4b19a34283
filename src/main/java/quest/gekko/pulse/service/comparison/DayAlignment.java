package quest.gekko.pulse.service.comparison;

import java.time.LocalDate;

/**
 * One day of a comparison. A side with no data that day is null, never zero.
 */
public record DayAlignment(LocalDate date,
                           Double socialPolarity,
                           Integer socialCount,
                           Double surveyPolarity,
                           Integer surveyCount,
                           Double delta,
                           Double rollingAlignment) {

    public boolean isSocialAbsent() {
        return socialPolarity == null;
    }

    public boolean isSurveyAbsent() {
        return surveyPolarity == null;
    }
}
