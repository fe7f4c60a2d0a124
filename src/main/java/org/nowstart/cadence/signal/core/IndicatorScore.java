package org.nowstart.cadence.signal.core;

public record IndicatorScore(
        String name,
        double score,
        String detail
) {

    public IndicatorScore {
        if (Double.isNaN(score) || score < -1.0 || score > 1.0) {
            throw new IllegalArgumentException("indicator score must be in [-1, 1], got " + score);
        }
    }

    public static IndicatorScore neutral(String name, String detail) {
        return new IndicatorScore(name, 0.0, detail);
    }
}
