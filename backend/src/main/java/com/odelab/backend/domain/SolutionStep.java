package com.odelab.backend.domain;

public record SolutionStep(
        String title,
        String description,
        String equationLine
) {
    public static SolutionStep of(String title, String description) {
        return new SolutionStep(title, description, null);
    }

    public static SolutionStep of(String title, String description, String equationLine) {
        return new SolutionStep(title, description, equationLine);
    }
}
