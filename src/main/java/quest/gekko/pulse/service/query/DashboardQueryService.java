package quest.gekko.pulse.service.query;

import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PipelineSettings;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.domain.Sources;
import quest.gekko.pulse.domain.Title;
import quest.gekko.pulse.exception.UnknownTitleException;
import quest.gekko.pulse.service.ingest.TitleRegistry;
import quest.gekko.pulse.service.store.PipelineStore;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

@Service
@RequiredArgsConstructor
public class DashboardQueryService {
    static final int MAX_RANGE_DAYS = 366;

    private final PipelineStore store;
    private final TitleRegistry titles;
    private final PipelineSettings settings;
    private final Clock clock;

    public List<Title> titles() {
        return titles.all();
    }

    /** Stored daily aggregates, oldest first. Days never aggregated are simply missing. */
    @Cacheable(value = "aggregates", key = "#titleId + ':' + #source + ':' + #from + ':' + #to")
    public List<DailyAggregate> aggregates(String titleId, String source, LocalDate from, LocalDate to) {
        if (!titles.contains(titleId)) throw new UnknownTitleException(titleId);
        String s = Sources.normalize(source == null ? Sources.SOCIAL : source);
        if (!Sources.isValid(s)) throw new IllegalArgumentException("Invalid source: " + source);
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("Invalid date range: " + from + " .. " + to);
        }
        if (from.plusDays(MAX_RANGE_DAYS).isBefore(to)) {
            throw new IllegalArgumentException("Date range longer than " + MAX_RANGE_DAYS + " days");
        }
        return store.getAggregates(titleId, s, from, to);
    }

    /**
     * Rolls up the last {@code days} UTC days, today included. Sentiment averages are weighted by
     * the rows behind each daily mean, so a busy day counts for more than a quiet one.
     */
    @Cacheable(value = "aggregates", key = "'summary:' + #titleId + ':' + #days")
    public TitleSummary summary(String titleId, int days) {
        if (!titles.contains(titleId)) throw new UnknownTitleException(titleId);
        if (days < 1 || days > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_RANGE_DAYS + ": " + days);
        }
        LocalDate to = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate from = to.minusDays(days - 1L);

        Set<String> tags = new LinkedHashSet<>(settings.getPlatforms());
        tags.add(Sources.SOCIAL);
        Map<String, TitleSummary.PlatformSummary> platforms = new LinkedHashMap<>();
        for (String tag : tags) {
            platforms.put(tag, platformSummary(store.getAggregates(titleId, tag, from, to)));
        }
        return new TitleSummary(titleId, from, to, days, platforms,
                surveySummary(store.getAggregates(titleId, Sources.SURVEY, from, to)));
    }

    private static TitleSummary.PlatformSummary platformSummary(List<DailyAggregate> aggregates) {
        return new TitleSummary.PlatformSummary(
                weightedMean(aggregates, DailyAggregate::getMeanPolarity, DailyAggregate::getMeanCount),
                aggregates.stream().mapToInt(DailyAggregate::getCount).sum(),
                aggregates.stream().mapToInt(DailyAggregate::getPositiveCount).sum(),
                aggregates.stream().mapToInt(DailyAggregate::getNeutralCount).sum(),
                aggregates.stream().mapToInt(DailyAggregate::getNegativeCount).sum());
    }

    private static TitleSummary.SurveySummary surveySummary(List<DailyAggregate> aggregates) {
        List<DailyAggregate> rated = aggregates.stream().filter(a -> a.getMeanSatisfaction() != null).toList();
        List<DailyAggregate> recommended = aggregates.stream().filter(a -> a.getRecommendationRate() != null).toList();
        return new TitleSummary.SurveySummary(
                weightedMean(rated, DailyAggregate::getMeanSatisfaction, DailyAggregate::getCount),
                weightedMean(recommended, DailyAggregate::getRecommendationRate, DailyAggregate::getCount),
                aggregates.stream().mapToInt(DailyAggregate::getCount).sum());
    }

    private static Double weightedMean(List<DailyAggregate> aggregates, ToDoubleFunction<DailyAggregate> value,
                                       ToIntFunction<DailyAggregate> weight) {
        double sum = 0.0;
        long total = 0;
        for (DailyAggregate a : aggregates) {
            int w = weight.applyAsInt(a);
            sum += value.applyAsDouble(a) * w;
            total += w;
        }
        if (total == 0) return null;
        return Math.round(sum / total * 1_000_000d) / 1_000_000d;
    }
}
