package com.odelab.backend.expr.integrate;

import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.Operator;
import com.odelab.backend.expr.Simplifier;
import com.odelab.backend.expr.Symbol;

import java.util.Optional;

import static com.odelab.backend.expr.Simplifier.EPSILON;

/**
 * Recognizes expressions that are affine in one variable. Only sums,
 * differences, negation and products/quotients by numeric literals are
 * walked; any other use of the variable fails the match.
 */
public final class AffineMatcher {

    private AffineMatcher() {}

    public static Optional<LinearForm> match(Expr node, Symbol v) {
        LinearForm raw = walk(node, v);
        if (raw == null) return Optional.empty();
        double a = Math.abs(raw.a()) < EPSILON ? 0 : raw.a();
        return Optional.of(new LinearForm(a, Simplifier.simplify(raw.b())));
    }

    private static LinearForm walk(Expr node, Symbol v) {
        if (!node.dependsOn(v)) return new LinearForm(0, node);
        if (node.isVar(v)) return new LinearForm(1, Expr.num(0));

        if (node instanceof Expr.Neg n) {
            LinearForm inner = walk(n.argument(), v);
            if (inner == null) return null;
            return new LinearForm(-inner.a(), Simplifier.negate(inner.b()));
        }
        if (!(node instanceof Expr.Binary b)) return null;

        switch (b.op()) {
            case ADD, SUB -> {
                LinearForm left = walk(b.left(), v);
                LinearForm right = walk(b.right(), v);
                if (left == null || right == null) return null;
                return b.op() == Operator.ADD
                        ? new LinearForm(left.a() + right.a(), Simplifier.add(left.b(), right.b()))
                        : new LinearForm(left.a() - right.a(), Simplifier.sub(left.b(), right.b()));
            }
            case MUL -> {
                Expr constant = b.left().dependsOn(v) ? b.right() : b.left();
                Expr rest = constant == b.left() ? b.right() : b.left();
                if (constant.dependsOn(v) || !(constant instanceof Expr.Num c)) return null;
                LinearForm inner = walk(rest, v);
                if (inner == null) return null;
                return new LinearForm(inner.a() * c.value(), Simplifier.mul(c, inner.b()));
            }
            case DIV -> {
                if (b.right().dependsOn(v) || !(b.right() instanceof Expr.Num c)) return null;
                if (Math.abs(c.value()) < EPSILON) return null;
                LinearForm inner = walk(b.left(), v);
                if (inner == null) return null;
                return new LinearForm(inner.a() / c.value(), Simplifier.div(inner.b(), c));
            }
            default -> {
                return null;
            }
        }
    }
}
