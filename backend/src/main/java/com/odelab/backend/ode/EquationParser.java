package com.odelab.backend.ode;

import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.parse.ExpressionParser;
import com.odelab.backend.expr.parse.ExpressionSyntaxException;

import java.util.Locale;

public final class EquationParser {

    private static final String LHS = "dy/dx";

    private EquationParser() {}

    public static ParsedEquation parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionSyntaxException("Equation is empty.");
        }
        String cleaned = text.replaceAll("\\s+", " ").replace('،', ',').trim();
        int eq = cleaned.indexOf('=');
        if (eq < 0) {
            throw new ExpressionSyntaxException("Equation must contain '='.");
        }
        if (cleaned.indexOf('=', eq + 1) >= 0) {
            throw new ExpressionSyntaxException("Equation must contain exactly one '='.");
        }
        String lhs = cleaned.substring(0, eq).replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        if (!LHS.equals(lhs)) {
            throw new ExpressionSyntaxException("Left-hand side must be dy/dx.");
        }
        Expr rhs = ExpressionParser.parse(cleaned.substring(eq + 1).trim());
        if (hasUndefinedConstant(rhs)) {
            throw new ExpressionSyntaxException("Right-hand side contains an undefined value such as 1/0.");
        }
        return new ParsedEquation(rhs, LHS + " = " + rhs.render());
    }

    // constant folding turns 1/0 or 0/0 into a non-finite literal
    private static boolean hasUndefinedConstant(Expr node) {
        if (node instanceof Expr.Num n) return !Double.isFinite(n.value());
        if (node instanceof Expr.Neg n) return hasUndefinedConstant(n.argument());
        if (node instanceof Expr.Call c) return hasUndefinedConstant(c.argument());
        if (node instanceof Expr.Binary b) return hasUndefinedConstant(b.left()) || hasUndefinedConstant(b.right());
        return false;
    }
}
