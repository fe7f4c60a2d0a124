package org.nowstart.cadence.signal.core;

public final class ScoreMath {

    private ScoreMath() {
    }

    public static double clip(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static double clipScore(double value) {
        return clip(value, -1.0, 1.0);
    }

    public static double clipUnit(double value) {
        return clip(value, 0.0, 1.0);
    }

    public static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
