package com.bko.readiness.recovery.app;

import java.util.Arrays;

/**
 * Piecewise linear mapping over fixed (x, score) reference points. Inputs outside the first and
 * last point clamp to that point's score.
 */
final class ReferenceCurve {
    private final double[] xs;
    private final double[] ys;

    private ReferenceCurve(double[] xs, double[] ys) {
        this.xs = xs;
        this.ys = ys;
    }

    static ReferenceCurve of(double... points) {
        if (points.length < 4 || points.length % 2 != 0) {
            throw new IllegalArgumentException("A curve needs at least two (x, y) pairs");
        }
        double[] xs = new double[points.length / 2];
        double[] ys = new double[points.length / 2];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = points[2 * i];
            ys[i] = points[2 * i + 1];
            if (i > 0 && xs[i] <= xs[i - 1]) {
                throw new IllegalArgumentException("Reference points must be strictly increasing: " + Arrays.toString(points));
            }
        }
        return new ReferenceCurve(xs, ys);
    }

    double valueAt(double x) {
        int last = xs.length - 1;
        if (x <= xs[0]) {
            return ys[0];
        }
        if (x >= xs[last]) {
            return ys[last];
        }
        for (int i = 0; i < last; i++) {
            if (x <= xs[i + 1]) {
                double fraction = (x - xs[i]) / (xs[i + 1] - xs[i]);
                return ys[i] + (ys[i + 1] - ys[i]) * fraction;
            }
        }
        return ys[last];
    }

    int scoreAt(double x) {
        return round(valueAt(x));
    }

    /**
     * Rounds half to even, so 62.5 becomes 62 and 63.5 becomes 64.
     */
    static int round(double value) {
        return (int) Math.rint(value);
    }
}
