package quest.gekko.pulse.service.survey;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.SurveyResponse;
import quest.gekko.pulse.domain.Title;
import quest.gekko.pulse.exception.UnknownTitleException;
import quest.gekko.pulse.service.ingest.TitleRegistry;
import quest.gekko.pulse.service.store.PipelineStore;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stores survey responses. A response is immutable: a second submission by the same
 * respondent for the same title is ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurveyService {
    private static final int MAX_REPORTED_ERRORS = 20;

    private final PipelineStore store;
    private final TitleRegistry titles;
    private final PipelineSettings settings;
    private final Clock clock;

    /**
     * @return the stored response, or empty when this respondent already answered for the title
     * @throws IllegalArgumentException for a blank respondent or a value off the scale
     * @throws UnknownTitleException    when the title is not tracked
     */
    public Optional<SurveyResponse> record(SurveySubmission submission) {
        SurveyResponse response = validate(submission);
        if (store.getResponse(response.getRespondentId(), response.getTitleId()).isPresent()) {
            log.debug("Ignoring repeated survey response {} for {}", response.getRespondentId(), response.getTitleId());
            return Optional.empty();
        }
        return Optional.of(store.putResponse(response));
    }

    /**
     * Imports a CSV export with a header row. Recognised columns: {@code respondent_id},
     * {@code title} (or {@code title_id}), {@code satisfaction} (or {@code satisfaction_score}),
     * {@code submitted_at} (or {@code created_at}; ISO instant or date), {@code would_recommend},
     * {@code completion_rate}. Quoted cells may contain commas, doubled quotes and line breaks.
     * Bad rows are counted and skipped; errors name the line the row starts on.
     */
    public SurveyImportSummary importCsv(Reader source) {
        int stored = 0, duplicates = 0, invalid = 0;
        List<String> errors = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(source)) {
            String header = reader.readLine();
            if (header == null) return new SurveyImportSummary(0, 0, 0, List.of());
            Map<String, Integer> columns = columns(header);
            for (String column : List.of("respondent_id", "title", "satisfaction")) {
                if (!columns.containsKey(column)) {
                    throw new IllegalArgumentException("CSV header lacks column " + column);
                }
            }

            String line;
            int lineNo = 1;
            while ((line = reader.readLine()) != null) {
                int startLine = ++lineNo;
                if (line.isBlank()) continue;
                StringBuilder row = new StringBuilder(line);
                // a quoted cell may run over several physical lines
                while (hasOpenQuote(row) && (line = reader.readLine()) != null) {
                    row.append('\n').append(line);
                    lineNo++;
                }
                try {
                    if (hasOpenQuote(row)) throw new IllegalArgumentException("unterminated quoted cell");
                    if (record(parse(split(row.toString()), columns)).isPresent()) stored++;
                    else duplicates++;
                } catch (IllegalArgumentException | UnknownTitleException | DateTimeParseException e) {
                    invalid++;
                    if (errors.size() < MAX_REPORTED_ERRORS) errors.add("line " + startLine + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read survey CSV", e);
        }
        log.info("Survey import: {} stored, {} duplicates, {} invalid", stored, duplicates, invalid);
        return new SurveyImportSummary(stored, duplicates, invalid, errors);
    }

    private SurveyResponse validate(SurveySubmission s) {
        if (s.respondentId() == null || s.respondentId().isBlank()) {
            throw new IllegalArgumentException("respondentId is required");
        }
        Title title = titles.find(s.title()).orElseThrow(() -> new UnknownTitleException(s.title()));
        if (s.satisfaction() == null
                || s.satisfaction() < settings.getSurveyScaleMin() || s.satisfaction() > settings.getSurveyScaleMax()) {
            throw new IllegalArgumentException("satisfaction must be within [" + settings.getSurveyScaleMin()
                    + ", " + settings.getSurveyScaleMax() + "], was " + s.satisfaction());
        }
        if (s.completionRate() != null && (s.completionRate() < 0.0 || s.completionRate() > 1.0)) {
            throw new IllegalArgumentException("completionRate must be within [0, 1], was " + s.completionRate());
        }
        return SurveyResponse.builder()
                .respondentId(s.respondentId().trim())
                .titleId(title.id())
                .satisfaction(s.satisfaction())
                .wouldRecommend(s.wouldRecommend())
                .completionRate(s.completionRate())
                .submittedAt(s.submittedAt() == null ? clock.instant() : s.submittedAt())
                .build();
    }

    private static SurveySubmission parse(List<String> cells, Map<String, Integer> columns) {
        String satisfaction = cell(cells, columns, "satisfaction");
        String submitted = cell(cells, columns, "submitted_at");
        String recommend = cell(cells, columns, "would_recommend");
        String completion = cell(cells, columns, "completion_rate");
        try {
            return new SurveySubmission(
                    cell(cells, columns, "respondent_id"),
                    cell(cells, columns, "title"),
                    satisfaction == null ? null : Integer.valueOf(satisfaction),
                    submitted == null ? null : parseInstant(submitted),
                    recommend == null ? null : Boolean.valueOf(recommend),
                    completion == null ? null : Double.valueOf(completion));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + e.getMessage(), e);
        }
    }

    private static Instant parseInstant(String value) {
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return Instant.parse(value);
    }

    private static Map<String, Integer> columns(String header) {
        Map<String, Integer> columns = new HashMap<>();
        List<String> names = split(header);
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i).toLowerCase(Locale.ROOT);
            switch (name) {
                case "title_id" -> name = "title";
                case "satisfaction_score" -> name = "satisfaction";
                case "created_at" -> name = "submitted_at";
                default -> { }
            }
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    private static String cell(List<String> cells, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= cells.size()) return null;
        String value = cells.get(index);
        return value.isEmpty() ? null : value;
    }

    // comma separated, double quotes around a field allowed, "" inside quotes is a quote
    private static boolean hasOpenQuote(CharSequence row) {
        int quotes = 0;
        for (int i = 0; i < row.length(); i++) {
            if (row.charAt(i) == '"') quotes++;
        }
        return quotes % 2 == 1;
    }

    static List<String> split(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString().trim());
        return cells;
    }
}
