package com.odelab.backend.ode;

import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.Operator;
import com.odelab.backend.expr.Simplifier;
import com.odelab.backend.expr.Symbol;

import java.util.ArrayList;
import java.util.List;

public final class OdeClassifier {

    private static final Symbol X = Symbol.X;
    private static final Symbol Y = Symbol.Y;

    record Factor(Expr node, boolean denominator) {}

    private OdeClassifier() {}

    public static Classification classify(Expr rhs) {
        if (!rhs.dependsOn(Y)) return new Classification.Direct(rhs);

        Classification separable = separable(rhs);
        if (separable != null) return separable;

        Classification linear = linear(rhs);
        if (linear != null) return linear;

        return new Classification.Unsupported();
    }

    // ---------------- separable ----------------

    static Classification.Separable separable(Expr rhs) {
        List<Expr> xNum = new ArrayList<>();
        List<Expr> xDen = new ArrayList<>();
        List<Expr> yNum = new ArrayList<>();
        List<Expr> yDen = new ArrayList<>();
        List<Expr> cNum = new ArrayList<>();
        List<Expr> cDen = new ArrayList<>();

        for (Factor f : flattenProduct(rhs)) {
            boolean hasX = f.node().dependsOn(X);
            boolean hasY = f.node().dependsOn(Y);
            if (hasX && hasY) return null;
            if (hasY) {
                (f.denominator() ? yDen : yNum).add(f.node());
            } else if (hasX) {
                (f.denominator() ? xDen : xNum).add(f.node());
            } else {
                (f.denominator() ? cDen : cNum).add(f.node());
            }
        }
        if (yNum.isEmpty() && yDen.isEmpty()) return null;

        xNum.addAll(cNum);
        xDen.addAll(cDen);
        Expr xPart = buildProduct(xNum, xDen);
        Expr yPart = buildProduct(yNum, yDen);
        if (!yPart.dependsOn(Y)) return null;
        return new Classification.Separable(xPart, yPart);
    }

    // ---------------- linear ----------------

    static Classification.Linear linear(Expr rhs) {
        List<Expr> coefficients = new ArrayList<>();
        List<Expr> free = new ArrayList<>();
        for (Expr term : flattenSum(rhs)) {
            if (!term.dependsOn(Y)) {
                free.add(term);
                continue;
            }
            Expr coefficient = linearCoefficient(term);
            if (coefficient == null) return null;
            coefficients.add(coefficient);
        }
        if (coefficients.isEmpty()) return null;

        Expr a = Simplifier.simplify(sum(coefficients));
        Expr b = Simplifier.simplify(sum(free));
        if (a.dependsOn(Y) || b.dependsOn(Y)) return null;
        return new Classification.Linear(a, b);
    }

    /**
     * Coefficient of a term holding exactly one bare {@code y} numerator factor, or null.
     */
    static Expr linearCoefficient(Expr term) {
        List<Expr> numerator = new ArrayList<>();
        List<Expr> denominator = new ArrayList<>();
        int yCount = 0;
        for (Factor f : flattenProduct(term)) {
            Expr node = f.node();
            if (f.denominator()) {
                if (node.dependsOn(Y)) return null;
                denominator.add(node);
            } else if (node.isVar(Y)) {
                yCount++;
            } else if (node.dependsOn(Y)) {
                return null;
            } else {
                numerator.add(node);
            }
        }
        return yCount == 1 ? buildProduct(numerator, denominator) : null;
    }

    // ---------------- flattening ----------------

    static List<Factor> flattenProduct(Expr node) {
        List<Factor> out = new ArrayList<>();
        collectFactors(node, false, out);
        return out;
    }

    private static void collectFactors(Expr node, boolean denominator, List<Factor> out) {
        if (node instanceof Expr.Binary b && b.op() == Operator.MUL) {
            collectFactors(b.left(), denominator, out);
            collectFactors(b.right(), denominator, out);
        } else if (node instanceof Expr.Binary b && b.op() == Operator.DIV) {
            collectFactors(b.left(), denominator, out);
            collectFactors(b.right(), !denominator, out);
        } else if (node instanceof Expr.Neg n) {
            out.add(new Factor(Expr.num(-1), denominator));
            collectFactors(n.argument(), denominator, out);
        } else {
            out.add(new Factor(node, denominator));
        }
    }

    /** Terms of a sum; subtracted terms come back multiplied by -1. */
    static List<Expr> flattenSum(Expr node) {
        List<Expr> out = new ArrayList<>();
        collectTerms(node, false, out);
        return out;
    }

    private static void collectTerms(Expr node, boolean negative, List<Expr> out) {
        if (node instanceof Expr.Binary b && b.op() == Operator.ADD) {
            collectTerms(b.left(), negative, out);
            collectTerms(b.right(), negative, out);
        } else if (node instanceof Expr.Binary b && b.op() == Operator.SUB) {
            collectTerms(b.left(), negative, out);
            collectTerms(b.right(), !negative, out);
        } else if (node instanceof Expr.Neg n) {
            collectTerms(n.argument(), !negative, out);
        } else {
            out.add(negative ? Simplifier.mul(Expr.num(-1), node) : node);
        }
    }

    static Expr buildProduct(List<Expr> numerator, List<Expr> denominator) {
        Expr result = null;
        for (Expr n : numerator) {
            result = result == null ? n : Simplifier.mul(result, n);
        }
        if (result == null) result = Expr.num(1);
        for (Expr d : denominator) {
            result = Simplifier.div(result, d);
        }
        return Simplifier.simplify(result);
    }

    private static Expr sum(List<Expr> terms) {
        Expr result = null;
        for (Expr t : terms) {
            result = result == null ? t : Simplifier.add(result, t);
        }
        return result == null ? Expr.num(0) : result;
    }
}
