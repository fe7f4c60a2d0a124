package org.nowstart.cadence.signal.indicator;

import java.util.Locale;
import org.nowstart.cadence.signal.core.IndicatorScore;
import org.nowstart.cadence.signal.core.ScoreMath;

/**
 * RSI 30 maps to +1 (oversold), RSI 70 to -1 (overbought).
 */
public class RsiScorer implements IndicatorScorer {

    public static final String NAME = "RSI";

    private final int period;

    public RsiScorer() {
        this(14);
    }

    public RsiScorer(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.period = period;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public IndicatorScore score(double[] close) {
        double rsi = close == null ? Double.NaN : IndicatorMath.wilderRsi(close, period);
        if (Double.isNaN(rsi)) {
            return IndicatorScore.neutral(NAME, "RSI: insufficient data");
        }

        double score = ScoreMath.round4(ScoreMath.clipScore((50.0 - rsi) / 20.0));
        return new IndicatorScore(
                NAME,
                score,
                String.format(Locale.ROOT, "RSI(%d)=%.1f -> %+.2f", period, rsi, score)
        );
    }
}
