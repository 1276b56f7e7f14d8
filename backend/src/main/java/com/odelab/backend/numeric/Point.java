package com.odelab.backend.numeric;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Point(double x, double y) {
    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
