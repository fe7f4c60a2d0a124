package org.nowstart.cadence.signal.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Piecewise-linear mapping over an ordered list of (x, y) breakpoints.
 *
 * <p>Inputs between two breakpoints are interpolated linearly. Inputs above the last
 * breakpoint take the last y. Inputs below the first breakpoint take the first y unless
 * a separate {@code belowRange} value was configured.
 */
public final class BreakpointTable {

    private final double[] xs;
    private final double[] ys;
    private final Double belowRange;

    private BreakpointTable(double[] xs, double[] ys, Double belowRange) {
        this.xs = xs;
        this.ys = ys;
        this.belowRange = belowRange;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double interpolate(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (x < xs[0]) {
            return belowRange != null ? belowRange : ys[0];
        }
        int last = xs.length - 1;
        if (x >= xs[last]) {
            return ys[last];
        }
        for (int i = 1; i <= last; i++) {
            if (x <= xs[i]) {
                double ratio = (x - xs[i - 1]) / (xs[i] - xs[i - 1]);
                return ys[i - 1] + ratio * (ys[i] - ys[i - 1]);
            }
        }
        return ys[last];
    }

    public int segmentIndex(double x) {
        for (int i = 1; i < xs.length; i++) {
            if (x <= xs[i]) {
                return i - 1;
            }
        }
        return xs.length - 2;
    }

    public static final class Builder {

        private final List<double[]> points = new ArrayList<>();
        private Double belowRange;

        private Builder() {
        }

        public Builder point(double x, double y) {
            if (!points.isEmpty() && x <= points.get(points.size() - 1)[0]) {
                throw new IllegalArgumentException("breakpoints must be strictly increasing, got x=" + x);
            }
            points.add(new double[] {x, y});
            return this;
        }

        public Builder belowRange(double y) {
            this.belowRange = y;
            return this;
        }

        public BreakpointTable build() {
            if (points.size() < 2) {
                throw new IllegalArgumentException("at least two breakpoints are required");
            }
            double[] xs = new double[points.size()];
            double[] ys = new double[points.size()];
            for (int i = 0; i < points.size(); i++) {
                xs[i] = points.get(i)[0];
                ys[i] = points.get(i)[1];
            }
            return new BreakpointTable(xs, ys, belowRange);
        }
    }
}
