package com.odelab.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EquationKind {
    DIRECT,
    SEPARABLE,
    LINEAR,
    UNSUPPORTED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
