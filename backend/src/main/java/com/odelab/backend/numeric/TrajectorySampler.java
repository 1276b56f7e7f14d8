package com.odelab.backend.numeric;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Classical fourth-order Runge-Kutta, stepped forward and backward from an
 * initial point with a fixed step count per side.
 */
public final class TrajectorySampler {

    public static final double DEFAULT_SPAN = 4;
    public static final int DEFAULT_STEPS = 160;

    private TrajectorySampler() {}

    public static Trajectory sample(DerivativeFunction f, double x0, double y0) {
        return sample(f, x0, y0, DEFAULT_SPAN, DEFAULT_STEPS);
    }

    public static Trajectory sample(DerivativeFunction f, double x0, double y0, double span, int steps) {
        if (steps <= 0) throw new IllegalArgumentException("steps must be positive: " + steps);
        List<Point> forward = walk(f, x0, y0, span / steps, steps);
        List<Point> backward = walk(f, x0, y0, -span / steps, steps);
        Collections.reverse(backward);
        return new Trajectory(new Point(x0, y0), forward, backward);
    }

    /** Stops at the first step whose y is not finite. */
    static List<Point> walk(DerivativeFunction f, double x0, double y0, double h, int steps) {
        List<Point> points = new ArrayList<>(steps);
        double x = x0;
        double y = y0;
        for (int i = 0; i < steps; i++) {
            double next = step(f, x, y, h);
            if (!Double.isFinite(next)) break;
            x += h;
            y = next;
            points.add(new Point(x, y));
        }
        return points;
    }

    static double step(DerivativeFunction f, double x, double y, double h) {
        double k1 = slope(f, x, y);
        double k2 = slope(f, x + h / 2, y + h * k1 / 2);
        double k3 = slope(f, x + h / 2, y + h * k2 / 2);
        double k4 = slope(f, x + h, y + h * k3);
        return y + (h / 6) * (k1 + 2 * k2 + 2 * k3 + k4);
    }

    // non-finite slope counts as 0
    private static double slope(DerivativeFunction f, double x, double y) {
        double v = f.slope(x, y);
        return Double.isFinite(v) ? v : 0;
    }
}
