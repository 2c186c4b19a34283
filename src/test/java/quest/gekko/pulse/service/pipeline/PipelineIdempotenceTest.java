package quest.gekko.pulse.service.pipeline;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import quest.gekko.pulse.domain.DailyAggregate;
import quest.gekko.pulse.service.comparison.AlignmentReport;
import quest.gekko.pulse.service.comparison.AlignmentService;
import quest.gekko.pulse.service.ingest.RawContent;
import quest.gekko.pulse.service.store.PipelineStore;
import quest.gekko.pulse.service.survey.SurveyService;
import quest.gekko.pulse.service.survey.SurveySubmission;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PipelineIdempotenceTest {

    private static final Instant AT = Instant.parse("2024-01-05T10:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 1, 5);

    @Autowired
    PipelineService pipeline;
    @Autowired
    PipelineStore store;
    @Autowired
    SurveyService surveys;
    @Autowired
    AlignmentService alignment;

    private static List<RawContent> batch() {
        return List.of(
                new RawContent("twitter", "100", null, "Absolutely love Wednesday", "a", AT, 3L),
                new RawContent("twitter", "101", null, "Wednesday finale was boring", "b", AT.plusSeconds(5), 1L),
                new RawContent("reddit", null, "wednesday", "Nevermore looks great", "c", AT.plusSeconds(9), null),
                new RawContent("reddit", null, null, "Back to Winden, it is dark and good", "d", AT, 7L));
    }

    @Test
    void runningTheSameInputTwiceLeavesIdenticalAggregates() {
        RunSummary first = pipeline.run(batch());
        List<DailyAggregate> before = store.getAggregates("wednesday", "social", DAY, DAY);

        RunSummary second = pipeline.run(batch());
        List<DailyAggregate> after = store.getAggregates("wednesday", "social", DAY, DAY);

        assertThat(first.getIngested()).isEqualTo(4);
        assertThat(first.isFailed()).isFalse();
        assertThat(second.getIngested()).isZero();
        assertThat(second.getDuplicatesMerged()).isEqualTo(4);
        assertThat(before).hasSize(1);
        assertThat(before.get(0).getCount()).isEqualTo(3);
        assertThat(after).usingRecursiveFieldByFieldElementComparator().isEqualTo(before);
        assertThat(store.getAggregate("dark", "reddit", DAY).orElseThrow().getCount()).isEqualTo(1);
    }

    @Test
    void surveyAnswersShowUpInTheAlignmentReport() {
        pipeline.run(batch());
        surveys.record(new SurveySubmission("u1", "Wednesday", 5, AT, true, 1.0));
        surveys.record(new SurveySubmission("u2", "Wednesday", 2, AT, false, 0.4));
        pipeline.aggregate(DAY, DAY, List.of("wednesday"), List.of("survey"));

        AlignmentReport report = alignment.compare("wednesday", DAY, DAY);

        assertThat(report.days()).hasSize(1);
        assertThat(report.days().get(0).surveyCount()).isEqualTo(2);
        assertThat(report.days().get(0).surveyPolarity()).isEqualTo(0.25);
        assertThat(report.days().get(0).socialCount()).isEqualTo(3);
        assertThat(report.days().get(0).delta()).isNotNull();
    }
}
