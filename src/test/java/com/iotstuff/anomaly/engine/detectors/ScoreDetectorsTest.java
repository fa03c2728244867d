package com.iotstuff.anomaly.engine.detectors;

import com.iotstuff.anomaly.engine.DetectionContext;
import com.iotstuff.anomaly.engine.DetectorOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoreDetectorsTest {

    private static DetectionContext.DetectionContextBuilder base() {
        return DetectionContext.builder()
                .value(60.0)
                .window(List.of(50.0, 60.0))
                .mean(50.0)
                .std(4.0)
                .ewmaDeviation(6.0)
                .ewmstd(2.0)
                .previousValue(48.0)
                .hampelK(7);
    }

    @Test
    void zScore_scoresDistanceInStandardDeviations() {
        DetectorOutcome outcome = new ZScoreDetector().evaluate(base().build(), 2.4);

        assertThat(outcome.score()).isCloseTo(2.5, within(1e-12));
        assertThat(outcome.triggered()).isTrue();
    }

    @Test
    void zScore_zeroStd_abstains() {
        DetectorOutcome outcome = new ZScoreDetector().evaluate(base().std(0.0).build(), 2.0);

        assertThat(outcome.triggered()).isFalse();
    }

    @Test
    void ewma_scoresDeviationOverEwmstd() {
        DetectorOutcome outcome = new EwmaDetector().evaluate(base().build(), 3.0);

        assertThat(outcome.score()).isCloseTo(3.0, within(1e-12));
        assertThat(outcome.triggered()).isFalse(); // strictly greater required
    }

    @Test
    void ewma_zeroEwmstd_treatedAsOne() {
        DetectorOutcome outcome = new EwmaDetector().evaluate(base().ewmstd(0.0).build(), 2.0);

        assertThat(outcome.score()).isCloseTo(6.0, within(1e-12));
        assertThat(outcome.triggered()).isTrue();
    }

    @Test
    void rateOfChange_scoresJumpFromPreviousReading() {
        DetectorOutcome outcome = new RateOfChangeDetector().evaluate(base().build(), 10.0);

        assertThat(outcome.score()).isCloseTo(12.0, within(1e-12));
        assertThat(outcome.triggered()).isTrue();
    }

    @Test
    void rateOfChange_noPreviousReading_scoresZero() {
        DetectorOutcome outcome = new RateOfChangeDetector().evaluate(base().previousValue(null).build(), 0.0);

        assertThat(outcome.score()).isEqualTo(0.0);
        assertThat(outcome.triggered()).isFalse();
    }
}
