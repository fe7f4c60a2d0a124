package org.nowstart.cadence.signal.indicator;

import java.util.Locale;
import org.nowstart.cadence.signal.core.IndicatorScore;
import org.nowstart.cadence.signal.core.ScoreMath;

/**
 * Blend of MACD/signal crossover distance (60%) and histogram momentum (40%).
 */
public class MacdScorer implements IndicatorScorer {

    public static final String NAME = "MACD";

    private static final double CROSSOVER_WEIGHT = 0.6;
    private static final double MOMENTUM_WEIGHT = 0.4;
    private static final double CROSSOVER_SCALE_PCT = 1.0;

    private final int fast;
    private final int slow;
    private final int signal;

    public MacdScorer() {
        this(12, 26, 9);
    }

    public MacdScorer(int fast, int slow, int signal) {
        if (fast <= 0 || slow <= 0 || signal <= 0 || fast >= slow) {
            throw new IllegalArgumentException("require 0 < fast < slow and signal > 0");
        }
        this.fast = fast;
        this.slow = slow;
        this.signal = signal;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public IndicatorScore score(double[] close) {
        if (close == null || close.length == 0) {
            return IndicatorScore.neutral(NAME, "MACD: insufficient data");
        }

        int n = close.length;
        double[] emaFast = IndicatorMath.exponentialMovingAverage(close, fast);
        double[] emaSlow = IndicatorMath.exponentialMovingAverage(close, slow);
        double[] macd = IndicatorMath.fillNaN(n);
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(emaFast[i]) && Double.isFinite(emaSlow[i])) {
                macd[i] = emaFast[i] - emaSlow[i];
            }
        }
        double[] signalLine = IndicatorMath.exponentialMovingAverage(macd, signal);

        double macdLast = macd[n - 1];
        double signalLast = signalLine[n - 1];
        if (!Double.isFinite(macdLast) || !Double.isFinite(signalLast)) {
            return IndicatorScore.neutral(NAME, "MACD: insufficient data");
        }

        double price = close[n - 1];
        if (!Double.isFinite(price) || price == 0.0) {
            return IndicatorScore.neutral(NAME, "MACD: zero price");
        }

        double diffPct = (macdLast - signalLast) / price * 100.0;
        double crossover = ScoreMath.clipScore(diffPct / CROSSOVER_SCALE_PCT);
        double momentum = momentum(macd, signalLine);

        double score = ScoreMath.round4(ScoreMath.clipScore(CROSSOVER_WEIGHT * crossover + MOMENTUM_WEIGHT * momentum));
        return new IndicatorScore(
                NAME,
                score,
                String.format(Locale.ROOT, "MACD xover=%+.2f momentum=%+.2f -> %+.2f", crossover, momentum, score)
        );
    }

    static double momentumOf(double current, double previous) {
        if (current > 0.0 && current > previous) {
            return 1.0;
        }
        if (current > 0.0) {
            return 0.3;
        }
        if (current < 0.0 && current < previous) {
            return -1.0;
        }
        if (current < 0.0) {
            return -0.3;
        }
        return 0.0;
    }

    private double momentum(double[] macd, double[] signalLine) {
        int n = macd.length;
        if (n < 2) {
            return 0.0;
        }
        double current = macd[n - 1] - signalLine[n - 1];
        double previous = macd[n - 2] - signalLine[n - 2];
        if (!Double.isFinite(current) || !Double.isFinite(previous)) {
            return 0.0;
        }
        return momentumOf(current, previous);
    }
}
