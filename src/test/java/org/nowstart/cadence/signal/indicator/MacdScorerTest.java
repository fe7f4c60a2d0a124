package org.nowstart.cadence.signal.indicator;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.nowstart.cadence.signal.core.IndicatorScore;

class MacdScorerTest {

    private final MacdScorer scorer = new MacdScorer();

    @Test
    void momentumOf_distinguishesStrengtheningFromFading() {
        assertThat(MacdScorer.momentumOf(2.0, 1.0)).isEqualTo(1.0);
        assertThat(MacdScorer.momentumOf(1.0, 2.0)).isEqualTo(0.3);
        assertThat(MacdScorer.momentumOf(-2.0, -1.0)).isEqualTo(-1.0);
        assertThat(MacdScorer.momentumOf(-1.0, -2.0)).isEqualTo(-0.3);
        assertThat(MacdScorer.momentumOf(0.0, 5.0)).isZero();
    }

    @Test
    void score_shortSeriesIsNeutral() {
        IndicatorScore score = scorer.score(RsiScorerTest.series(20, 100.0, 1.0));

        assertThat(score.score()).isZero();
        assertThat(score.detail()).isEqualTo("MACD: insufficient data");
        assertThat(scorer.score(new double[0]).score()).isZero();
    }

    @Test
    void score_flatSeriesIsNeutral() {
        double[] close = new double[60];
        java.util.Arrays.fill(close, 30_000.0);

        assertThat(scorer.score(close).score()).isZero();
    }

    @Test
    void score_accelerationAfterFlatBaseIsPositive() {
        double[] close = new double[80];
        for (int i = 0; i < close.length; i++) {
            close[i] = i < 60 ? 100.0 : 100.0 + (i - 59) * (i - 59);
        }

        IndicatorScore score = scorer.score(close);

        assertThat(score.score()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        assertThat(score.detail()).startsWith("MACD xover=");
    }
}
