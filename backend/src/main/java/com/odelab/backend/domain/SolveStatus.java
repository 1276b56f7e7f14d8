package com.odelab.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SolveStatus {
    OK,
    UNSUPPORTED,   // parsed fine, but matches none of the solvable families
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
