package quest.gekko.pulse.service.comparison;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.exception.UnknownTitleException;
import quest.gekko.pulse.service.ingest.TitleRegistry;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lines up the stored {@code social} and {@code survey} aggregates of a title day by day.
 * Survey polarity is already rescaled to [-1, 1] by the aggregator, so the delta is a
 * plain difference. A bucket counts as absent when no row fed its mean: it is empty, or
 * every row fell under the confidence floor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlignmentService {
    private final PipelineStore store;
    private final TitleRegistry titles;
    private final PipelineSettings settings;

    @Cacheable(value = "alignment", key = "#titleId + ':' + #from + ':' + #to")
    public AlignmentReport compare(String titleId, LocalDate from, LocalDate to) {
        if (!titles.contains(titleId)) throw new UnknownTitleException(titleId);
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("Invalid date range: " + from + " .. " + to);
        }
        int window = settings.getWindowDays();
        // read the window before 'from' too, so the first rolling values are not truncated
        LocalDate readFrom = from.minusDays(window - 1L);
        Map<LocalDate, DailyAggregate> social = present(store.getAggregates(titleId, Sources.SOCIAL, readFrom, to));
        Map<LocalDate, DailyAggregate> survey = present(store.getAggregates(titleId, Sources.SURVEY, readFrom, to));

        List<DayAlignment> days = new ArrayList<>();
        List<double[]> allPairs = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            DailyAggregate s = social.get(day);
            DailyAggregate v = survey.get(day);
            if (s == null && v == null) continue;

            Double delta = null;
            if (s != null && v != null) {
                delta = round(v.getMeanPolarity() - s.getMeanPolarity());
                allPairs.add(new double[] { s.getMeanPolarity(), v.getMeanPolarity() });
            }
            days.add(new DayAlignment(day,
                    s == null ? null : s.getMeanPolarity(),
                    s == null ? null : s.getCount(),
                    v == null ? null : v.getMeanPolarity(),
                    v == null ? null : v.getCount(),
                    delta,
                    Correlation.pearson(pairsBetween(social, survey, day.minusDays(window - 1L), day), settings.getMinPairs())));
        }

        AlignmentReport report = new AlignmentReport(titleId, from, to, window, allPairs.size(),
                Correlation.pearson(allPairs, settings.getMinPairs()), days);
        log.debug("Alignment for {} {}..{}: {} days, {} paired", titleId, from, to, days.size(), allPairs.size());
        return report;
    }

    private static List<double[]> pairsBetween(Map<LocalDate, DailyAggregate> social, Map<LocalDate, DailyAggregate> survey,
                                               LocalDate from, LocalDate to) {
        List<double[]> pairs = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            DailyAggregate s = social.get(d);
            DailyAggregate v = survey.get(d);
            if (s != null && v != null) pairs.add(new double[] { s.getMeanPolarity(), v.getMeanPolarity() });
        }
        return pairs;
    }

    private static Map<LocalDate, DailyAggregate> present(List<DailyAggregate> aggregates) {
        Map<LocalDate, DailyAggregate> byDay = new TreeMap<>();
        aggregates.stream().filter(a -> a.getCount() > 0 && a.getMeanCount() > 0).forEach(a -> byDay.put(a.getDate(), a));
        return byDay;
    }

    private static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
