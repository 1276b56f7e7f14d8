package com.odelab.backend.numeric;

import java.util.List;

public record PlotWindow(double xMin, double xMax, double yMin, double yMax) {

    public static PlotWindow covering(List<Point> points) {
        if (points.isEmpty()) throw new IllegalArgumentException("no points to cover");
        double xMin = Double.POSITIVE_INFINITY, xMax = Double.NEGATIVE_INFINITY;
        double yMin = Double.POSITIVE_INFINITY, yMax = Double.NEGATIVE_INFINITY;
        for (Point p : points) {
            xMin = Math.min(xMin, p.x());
            xMax = Math.max(xMax, p.x());
            yMin = Math.min(yMin, p.y());
            yMax = Math.max(yMax, p.y());
        }
        // a zero-width axis is widened by one unit on each side
        if (xMin == xMax) {
            xMin -= 1;
            xMax += 1;
        }
        if (yMin == yMax) {
            yMin -= 1;
            yMax += 1;
        }
        return new PlotWindow(xMin, xMax, yMin, yMax);
    }
}
