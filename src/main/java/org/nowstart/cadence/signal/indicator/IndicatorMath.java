package org.nowstart.cadence.signal.indicator;

final class IndicatorMath {

    private IndicatorMath() {
    }

    static double[] exponentialMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] ema = fillNaN(n);
        if (length <= 0) {
            return ema;
        }

        int start = firstFinite(values);
        if (start < 0 || n - start < length) {
            return ema;
        }

        double seed = 0.0;
        for (int i = start; i < start + length; i++) {
            seed += values[i];
        }
        int first = start + length - 1;
        ema[first] = seed / length;

        double alpha = 2.0 / (length + 1.0);
        for (int i = first + 1; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    static double simpleMovingAverage(double[] values, int length) {
        int n = values.length;
        if (length <= 0 || n < length) {
            return Double.NaN;
        }
        double total = 0.0;
        for (int i = n - length; i < n; i++) {
            total += values[i];
        }
        return total / length;
    }

    /**
     * Wilder RSI of the last bar. Returns NaN when fewer than {@code period + 1} closes exist.
     */
    static double wilderRsi(double[] close, int period) {
        int n = close.length;
        if (period <= 0 || n < period + 1) {
            return Double.NaN;
        }

        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = close[i] - close[i - 1];
            if (change > 0.0) {
                gain += change;
            } else {
                loss -= change;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;

        for (int i = period + 1; i < n; i++) {
            double change = close[i] - close[i - 1];
            double up = change > 0.0 ? change : 0.0;
            double down = change < 0.0 ? -change : 0.0;
            avgGain = ((avgGain * (period - 1)) + up) / period;
            avgLoss = ((avgLoss * (period - 1)) + down) / period;
        }

        if (!Double.isFinite(avgGain) || !Double.isFinite(avgLoss)) {
            return Double.NaN;
        }
        if (avgGain == 0.0 && avgLoss == 0.0) {
            return 50.0;
        }
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    static double[] fillNaN(int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = Double.NaN;
        }
        return values;
    }

    private static int firstFinite(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                return i;
            }
        }
        return -1;
    }
}
