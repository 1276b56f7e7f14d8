package com.odelab.backend.domain;

import com.odelab.backend.numeric.PlotWindow;
import com.odelab.backend.numeric.Point;

import java.util.List;

public record TrajectoryResult(
        String normalizedEquation,
        double x0,
        double y0,
        boolean usedDefaults,   // x0 or y0 missing from the request
        List<Point> forward,
        List<Point> backward,
        List<Point> points,
        PlotWindow window       // null when fewer than two finite points
) {}
