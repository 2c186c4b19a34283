package quest.gekko.pulse.service.aggregation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AggregateCalculatorTest {

    private static AggregateCalculator calculator(double floor, LowConfidencePolicy policy) {
        return new AggregateCalculator(0.05, -0.05, floor, policy);
    }

    @Test
    void meanStddevAndBucketsOfADay() {
        BucketStats stats = calculator(0.0, LowConfidencePolicy.COUNT_ONLY).compute(List.of(
                new ScoredRow("b", -0.2, 1.0, false),
                new ScoredRow("a", 0.6, 1.0, false),
                new ScoredRow("c", 0.0, 1.0, false)));

        assertThat(stats.count()).isEqualTo(3);
        assertThat(stats.meanPolarity()).isCloseTo(0.133333, within(1e-6));
        assertThat(stats.stddevPolarity()).isCloseTo(0.339935, within(1e-6));
        assertThat(stats.positiveCount()).isEqualTo(1);
        assertThat(stats.neutralCount()).isEqualTo(1);
        assertThat(stats.negativeCount()).isEqualTo(1);
    }

    @Test
    void thresholdsAreInclusive() {
        BucketStats stats = calculator(0.0, LowConfidencePolicy.COUNT_ONLY).compute(List.of(
                new ScoredRow("a", 0.05, 1.0, false),
                new ScoredRow("b", -0.05, 1.0, false),
                new ScoredRow("c", 0.049, 1.0, false)));

        assertThat(stats.positiveCount()).isEqualTo(1);
        assertThat(stats.negativeCount()).isEqualTo(1);
        assertThat(stats.neutralCount()).isEqualTo(1);
    }

    @Test
    void emptyBucketIsAllZeros() {
        assertThat(calculator(0.0, LowConfidencePolicy.COUNT_ONLY).compute(List.of())).isEqualTo(BucketStats.EMPTY);
    }

    private static final List<ScoredRow> MIXED_CONFIDENCE = List.of(
            new ScoredRow("a", 0.6, 0.9, false),
            new ScoredRow("b", -0.2, 0.3, true),
            new ScoredRow("c", 0.0, 0.9, false));

    @Test
    void lowConfidenceRowsAreCountedButKeptOutOfTheMean() {
        BucketStats stats = calculator(0.5, LowConfidencePolicy.COUNT_ONLY).compute(MIXED_CONFIDENCE);

        assertThat(stats.count()).isEqualTo(3);
        assertThat(stats.lowConfidenceCount()).isEqualTo(1);
        assertThat(stats.negativeCount()).isEqualTo(1);
        assertThat(stats.fallbackCount()).isEqualTo(1);
        assertThat(stats.meanCount()).isEqualTo(2);
        assertThat(stats.meanPolarity()).isEqualTo(0.3);
        assertThat(stats.stddevPolarity()).isEqualTo(0.3);
    }

    @Test
    void bucketWithOnlyLowConfidenceRowsHasNoMeanRows() {
        BucketStats stats = calculator(0.6, LowConfidencePolicy.COUNT_ONLY).compute(List.of(
                new ScoredRow("a", -0.9, 0.55, false),
                new ScoredRow("b", -0.8, 0.52, false)));

        assertThat(stats.count()).isEqualTo(2);
        assertThat(stats.negativeCount()).isEqualTo(2);
        assertThat(stats.meanCount()).isZero();
        assertThat(stats.meanPolarity()).isEqualTo(0.0);
    }

    @Test
    void excludePolicyDropsLowConfidenceRows() {
        BucketStats stats = calculator(0.5, LowConfidencePolicy.EXCLUDE).compute(MIXED_CONFIDENCE);

        assertThat(stats.count()).isEqualTo(2);
        assertThat(stats.lowConfidenceCount()).isEqualTo(1);
        assertThat(stats.negativeCount()).isZero();
        assertThat(stats.fallbackCount()).isZero();
        assertThat(stats.meanPolarity()).isEqualTo(0.3);
    }

    @Test
    void inputOrderDoesNotChangeTheResult() {
        AggregateCalculator calc = calculator(0.0, LowConfidencePolicy.COUNT_ONLY);
        List<ScoredRow> rows = List.of(
                new ScoredRow("x", 0.1, 1.0, false), new ScoredRow("y", 0.7, 1.0, false), new ScoredRow("z", -0.3, 1.0, false));

        assertThat(calc.compute(rows)).isEqualTo(calc.compute(List.of(rows.get(2), rows.get(0), rows.get(1))));
    }
}
