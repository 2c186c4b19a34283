package quest.gekko.pulse.service.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.exception.UnknownTitleException;
import quest.gekko.pulse.service.store.InMemoryPipelineStore;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static quest.gekko.pulse.Fixtures.CLOCK;
import static quest.gekko.pulse.Fixtures.registry;
import static quest.gekko.pulse.Fixtures.settings;

class DashboardQueryServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);

    private InMemoryPipelineStore store;
    private DashboardQueryService queries;

    @BeforeEach
    void setUp() {
        store = new InMemoryPipelineStore();
        queries = new DashboardQueryService(store, registry(), settings(), CLOCK);
    }

    private void social(String source, LocalDate day, int count, int meanCount, double mean, int pos, int neu, int neg) {
        store.putAggregate(DailyAggregate.empty("wednesday", source, day, null).toBuilder()
                .count(count)
                .meanCount(meanCount)
                .meanPolarity(mean)
                .positiveCount(pos)
                .neutralCount(neu)
                .negativeCount(neg)
                .build());
    }

    private void survey(LocalDate day, int count, Double satisfaction, Double recommendation) {
        store.putAggregate(DailyAggregate.empty("wednesday", "survey", day, null).toBuilder()
                .count(count)
                .meanCount(count)
                .meanSatisfaction(satisfaction)
                .recommendationRate(recommendation)
                .build());
    }

    @Test
    void summaryRollsUpTheLastDaysPerPlatform() {
        social("twitter", TODAY, 3, 3, 0.5, 2, 1, 0);
        social("twitter", TODAY.minusDays(2), 1, 1, -0.3, 0, 0, 1);
        // outside a 3-day window
        social("twitter", TODAY.minusDays(3), 10, 10, -1.0, 0, 0, 10);
        social("reddit", TODAY.minusDays(1), 2, 0, 0.0, 0, 0, 2);
        survey(TODAY, 4, 4.0, 0.75);
        survey(TODAY.minusDays(1), 1, 2.0, null);

        TitleSummary summary = queries.summary("wednesday", 3);

        assertThat(summary.from()).isEqualTo(TODAY.minusDays(2));
        assertThat(summary.to()).isEqualTo(TODAY);
        assertThat(summary.platforms()).containsOnlyKeys("twitter", "reddit", "social");

        TitleSummary.PlatformSummary twitter = summary.platforms().get("twitter");
        assertThat(twitter.totalCount()).isEqualTo(4);
        assertThat(twitter.avgSentiment()).isEqualTo(0.3);
        assertThat(twitter.positive()).isEqualTo(2);
        assertThat(twitter.neutral()).isEqualTo(1);
        assertThat(twitter.negative()).isEqualTo(1);

        // only low-confidence rows on reddit: counted, but no average
        TitleSummary.PlatformSummary reddit = summary.platforms().get("reddit");
        assertThat(reddit.totalCount()).isEqualTo(2);
        assertThat(reddit.negative()).isEqualTo(2);
        assertThat(reddit.avgSentiment()).isNull();

        assertThat(summary.platforms().get("social").totalCount()).isZero();
        assertThat(summary.survey().totalCount()).isEqualTo(5);
        assertThat(summary.survey().avgSatisfaction()).isEqualTo(3.6);
        assertThat(summary.survey().recommendationRate()).isEqualTo(0.75);
    }

    @Test
    void summaryRefusesUnknownTitlesAndBadWindows() {
        assertThatThrownBy(() -> queries.summary("ozark", 7)).isInstanceOf(UnknownTitleException.class);
        assertThatThrownBy(() -> queries.summary("wednesday", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queries.summary("wednesday", DashboardQueryService.MAX_RANGE_DAYS + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
