package quest.gekko.pulse.service.survey;

import java.util.List;

public record SurveyImportSummary(int stored, int duplicates, int invalid, List<String> errors) {

    public SurveyImportSummary {
        errors = List.copyOf(errors);
    }
}
