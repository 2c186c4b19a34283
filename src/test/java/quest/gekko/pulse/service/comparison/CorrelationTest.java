package quest.gekko.pulse.service.comparison;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CorrelationTest {

    @Test
    void pearsonOfKnownSeries() {
        List<double[]> pairs = List.of(new double[] { 1, 2 }, new double[] { 2, 1 }, new double[] { 3, 4 }, new double[] { 4, 3 });

        assertThat(Correlation.pearson(pairs, 3)).isCloseTo(0.6, within(1e-6));
    }

    @Test
    void undefinedCasesAreNull() {
        List<double[]> flat = List.of(new double[] { 1, 0.5 }, new double[] { 2, 0.5 }, new double[] { 3, 0.5 });

        assertThat(Correlation.pearson(flat, 3)).isNull();
        assertThat(Correlation.pearson(List.of(new double[] { 1, 1 }, new double[] { 2, 2 }), 3)).isNull();
        assertThat(Correlation.pearson(List.of(), 2)).isNull();
    }
}
