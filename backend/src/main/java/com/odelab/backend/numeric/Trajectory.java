package com.odelab.backend.numeric;

import java.util.ArrayList;
import java.util.List;

/**
 * Solution curve sampled on both sides of an initial point. Both lists are in
 * increasing x order: {@code backward} ends next to the initial point and
 * {@code forward} starts next to it.
 */
public record Trajectory(Point initial, List<Point> forward, List<Point> backward) {

    public Trajectory {
        forward = List.copyOf(forward);
        backward = List.copyOf(backward);
    }

    /** backward, initial, forward; non-finite points dropped. */
    public List<Point> points() {
        List<Point> all = new ArrayList<>(backward.size() + forward.size() + 1);
        all.addAll(backward);
        all.add(initial);
        all.addAll(forward);
        all.removeIf(p -> !p.isFinite());
        return all;
    }
}
