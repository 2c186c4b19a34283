package quest.gekko.pulse.service.comparison;

import java.time.LocalDate;
import java.util.List;

/**
 * Social versus survey sentiment for one title over a date range.
 * {@code overallAlignment} is the correlation over all paired days, null when undefined.
 */
public record AlignmentReport(String titleId,
                              LocalDate from,
                              LocalDate to,
                              int windowDays,
                              int pairedDays,
                              Double overallAlignment,
                              List<DayAlignment> days) {

    public AlignmentReport {
        days = List.copyOf(days);
    }
}
