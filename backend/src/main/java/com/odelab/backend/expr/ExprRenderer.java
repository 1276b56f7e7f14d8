package com.odelab.backend.expr;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class ExprRenderer {

    private static final int ATOM_PRECEDENCE = 5;

    private ExprRenderer() {}

    public static String render(Expr node) {
        if (node instanceof Expr.Num n) return formatNumber(n.value());
        if (node instanceof Expr.Var v) return v.symbol().text();
        if (node instanceof Expr.Neg n) {
            String inner = render(n.argument());
            return n.argument() instanceof Expr.Binary ? "-(" + inner + ")" : "-" + inner;
        }
        if (node instanceof Expr.Call c) {
            return c.function().functionName() + "(" + render(c.argument()) + ")";
        }
        Expr.Binary b = (Expr.Binary) node;
        String left = render(b.left());
        String right = render(b.right());
        if (needsParens(b.left(), b.op(), false)) left = "(" + left + ")";
        if (needsParens(b.right(), b.op(), true)) right = "(" + right + ")";
        return left + " " + b.op().symbol() + " " + right;
    }

    private static int precedence(Expr node) {
        if (node instanceof Expr.Binary b) return b.op().precedence();
        if (node instanceof Expr.Neg) return Operator.NEGATION_PRECEDENCE;
        return ATOM_PRECEDENCE;
    }

    private static boolean needsParens(Expr child, Operator parent, boolean rightSide) {
        if (!(child instanceof Expr.Binary)) return false;
        int childPrec = precedence(child);
        if (childPrec < parent.precedence()) return true;
        if (childPrec != parent.precedence()) return false;
        // ^ groups to the right, so a left-nested power needs parentheses too
        return rightSide ? parent.groupsLeftOnly() : parent == Operator.POW;
    }

    /**
     * Integral values print without a fraction; everything else is rounded to
     * six decimals with trailing zeros dropped.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "Infinity" : "-Infinity";
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) return "0";
        return rounded.stripTrailingZeros().toPlainString();
    }
}
