package quest.gekko.pulse.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.domain.SurveyResponse;
import quest.gekko.pulse.exception.AggregationIntegrityException;
import quest.gekko.pulse.service.aggregation.AggregationService;
import quest.gekko.pulse.service.survey.SurveyImportSummary;
import quest.gekko.pulse.service.survey.SurveyService;
import quest.gekko.pulse.service.survey.SurveySubmission;

import java.io.StringReader;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Survey intake. A single response refreshes its day's survey bucket right away; a CSV import
 * is picked up by the next aggregate run.
 */
@Slf4j
@RestController
@RequestMapping("/api/surveys")
@RequiredArgsConstructor
public class SurveyController {
    private final SurveyService surveys;
    private final AggregationService aggregation;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SurveyResponse> submit(@RequestBody SurveySubmission submission) {
        Optional<SurveyResponse> stored = surveys.record(submission);
        if (stored.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        SurveyResponse response = stored.get();
        LocalDate day = LocalDate.ofInstant(response.getSubmittedAt(), ZoneOffset.UTC);
        try {
            aggregation.aggregate(response.getTitleId(), Sources.SURVEY, day);
        } catch (AggregationIntegrityException e) {
            // stored anyway; the bucket is outside what the dashboard keeps
            log.warn("Survey bucket {}/{} not refreshed: {}", response.getTitleId(), day, e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping(value = "/import", consumes = { "text/csv", MediaType.TEXT_PLAIN_VALUE })
    public SurveyImportSummary importCsv(@RequestBody String csv) {
        return surveys.importCsv(new StringReader(csv));
    }
}
