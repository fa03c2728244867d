package com.iotstuff.anomaly.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WindowStatisticsTest {

    @Test
    void mean_averagesValues() {
        assertThat(WindowStatistics.mean(List.of(1.0, 2.0, 3.0, 4.0))).isEqualTo(2.5);
    }

    @Test
    void mean_emptyWindow_throws() {
        assertThatThrownBy(() -> WindowStatistics.mean(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sampleStdDev_usesNMinusOneDenominator() {
        // Squared deviations from 5: 9, 1, 1, 1, 0, 0, 4, 16 -> 32 / 7
        List<Double> values = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);
        assertThat(WindowStatistics.sampleStdDev(values)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
    }

    @Test
    void sampleStdDev_singleReading_defaultsToOne() {
        assertThat(WindowStatistics.sampleStdDev(List.of(42.0))).isEqualTo(1.0);
        assertThat(WindowStatistics.sampleStdDev(List.of())).isEqualTo(1.0);
    }

    @Test
    void sampleStdDev_identicalReadings_isZero() {
        assertThat(WindowStatistics.sampleStdDev(List.of(3.0, 3.0, 3.0))).isEqualTo(0.0);
    }

    @Test
    void median_oddAndEvenSizes() {
        assertThat(WindowStatistics.median(List.of(5.0, 1.0, 3.0))).isEqualTo(3.0);
        assertThat(WindowStatistics.median(List.of(4.0, 1.0, 3.0, 2.0))).isEqualTo(2.5);
    }

    @Test
    void medianAbsoluteDeviation_aroundCenter() {
        // |x - 3| = 2, 1, 0, 1, 7 -> median 1
        List<Double> values = List.of(1.0, 2.0, 3.0, 4.0, 10.0);
        assertThat(WindowStatistics.medianAbsoluteDeviation(values, 3.0)).isEqualTo(1.0);
    }
}
