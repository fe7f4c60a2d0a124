package org.nowstart.cadence.signal.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.nowstart.cadence.signal.core.IndicatorScore;

class MovingAverageCrossoverScorerTest {

    private final MovingAverageCrossoverScorer scorer = new MovingAverageCrossoverScorer();

    @Test
    void score_shortSeriesIsNeutralWithReason() {
        IndicatorScore score = scorer.score(RsiScorerTest.series(120, 100.0, 1.0));

        assertThat(score.score()).isZero();
        assertThat(score.detail()).isEqualTo("MA cross: insufficient data (need 200 bars, have 120)");
    }

    @Test
    void score_uptrendIsPositiveAndClipped() {
        IndicatorScore score = scorer.score(RsiScorerTest.series(250, 1.0, 1.0));

        assertThat(score.score()).isEqualTo(1.0);
        assertThat(score.detail()).contains("SMA50=226").contains("SMA200=151");
    }

    @Test
    void score_downtrendIsNegative() {
        IndicatorScore score = scorer.score(RsiScorerTest.series(250, 50_000.0, -10.0));

        assertThat(score.score()).isLessThan(0.0);
    }

    @Test
    void score_scalesGapByConfiguredPercent() {
        double[] close = new double[20];
        Arrays.fill(close, 0, 10, 100.0);
        Arrays.fill(close, 10, 20, 102.0);
        MovingAverageCrossoverScorer shortScorer = new MovingAverageCrossoverScorer(10, 20, 5.0);

        IndicatorScore score = shortScorer.score(close);

        // SMA10=102, SMA20=101, gap 0.990% / 5%
        assertThat(score.score()).isEqualTo(0.198);
    }

    @Test
    void constructor_rejectsFastNotBelowSlow() {
        assertThatThrownBy(() -> new MovingAverageCrossoverScorer(200, 50, 5.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
