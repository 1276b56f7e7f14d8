package com.odelab.backend.domain;

import com.odelab.backend.expr.Expr;

import java.util.List;

// ok carries steps and finalSolution; unsupported only normalizedEquation, rhs, message; error only message
public record SolveResult(
        SolveStatus status,
        EquationKind classification,
        String normalizedEquation,
        String hint,
        List<SolutionStep> steps,
        String finalSolution,
        Expr rhs,
        String message
) {
    public static SolveResult ok(EquationKind kind, String normalizedEquation, String hint,
                                 List<SolutionStep> steps, String finalSolution, Expr rhs) {
        return new SolveResult(SolveStatus.OK, kind, normalizedEquation, hint,
                List.copyOf(steps), finalSolution, rhs, null);
    }

    public static SolveResult unsupported(String normalizedEquation, Expr rhs, String message) {
        return new SolveResult(SolveStatus.UNSUPPORTED, EquationKind.UNSUPPORTED, normalizedEquation,
                null, null, null, rhs, message);
    }

    public static SolveResult error(String message) {
        return new SolveResult(SolveStatus.ERROR, null, null, null, null, null, null, message);
    }
}
