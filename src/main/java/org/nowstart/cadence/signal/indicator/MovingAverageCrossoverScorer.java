package org.nowstart.cadence.signal.indicator;

import java.util.Locale;
import org.nowstart.cadence.signal.core.IndicatorScore;
import org.nowstart.cadence.signal.core.ScoreMath;

/**
 * Percentage gap between the fast and slow simple moving averages, scaled so that
 * {@code scalePct} maps to a full score.
 */
public class MovingAverageCrossoverScorer implements IndicatorScorer {

    public static final String NAME = "MA_Cross";

    private final int fast;
    private final int slow;
    private final double scalePct;

    public MovingAverageCrossoverScorer() {
        this(50, 200, 5.0);
    }

    public MovingAverageCrossoverScorer(int fast, int slow, double scalePct) {
        if (fast <= 0 || slow <= 0 || fast >= slow) {
            throw new IllegalArgumentException("require 0 < fast < slow, got fast=" + fast + ", slow=" + slow);
        }
        if (!(scalePct > 0.0)) {
            throw new IllegalArgumentException("scalePct must be > 0");
        }
        this.fast = fast;
        this.slow = slow;
        this.scalePct = scalePct;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public IndicatorScore score(double[] close) {
        int size = close == null ? 0 : close.length;
        if (size < slow) {
            return IndicatorScore.neutral(
                    NAME,
                    "MA cross: insufficient data (need " + slow + " bars, have " + size + ")"
            );
        }

        double smaFast = IndicatorMath.simpleMovingAverage(close, fast);
        double smaSlow = IndicatorMath.simpleMovingAverage(close, slow);
        if (!Double.isFinite(smaFast) || !Double.isFinite(smaSlow) || smaSlow == 0.0) {
            return IndicatorScore.neutral(NAME, "MA cross: insufficient data");
        }

        double gapPct = (smaFast - smaSlow) / smaSlow * 100.0;
        double score = ScoreMath.round4(ScoreMath.clipScore(gapPct / scalePct));
        return new IndicatorScore(
                NAME,
                score,
                String.format(
                        Locale.ROOT,
                        "SMA%d=%.0f SMA%d=%.0f gap=%+.2f%% -> %+.2f",
                        fast,
                        smaFast,
                        slow,
                        smaSlow,
                        gapPct,
                        score
                )
        );
    }
}
