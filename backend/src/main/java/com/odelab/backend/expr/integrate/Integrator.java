package com.odelab.backend.expr.integrate;

import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.MathFunction;
import com.odelab.backend.expr.Operator;
import com.odelab.backend.expr.Simplifier;
import com.odelab.backend.expr.Symbol;

import java.util.Optional;

import static com.odelab.backend.expr.Simplifier.EPSILON;
import static com.odelab.backend.expr.Simplifier.add;
import static com.odelab.backend.expr.Simplifier.call;
import static com.odelab.backend.expr.Simplifier.div;
import static com.odelab.backend.expr.Simplifier.mul;
import static com.odelab.backend.expr.Simplifier.negate;
import static com.odelab.backend.expr.Simplifier.pow;
import static com.odelab.backend.expr.Simplifier.sub;

/**
 * Rule-based antiderivatives. An empty result means no rule matched; callers
 * must treat that as "unsupported", never as zero.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>constant in {@code v}: {@code n * v}</li>
 *   <li>{@code v}: {@code v^2 / 2}</li>
 *   <li>negation, sum, difference: term by term</li>
 *   <li>product with exactly one constant side</li>
 *   <li>quotient by a constant, or constant over an affine denominator</li>
 *   <li>{@code v^p} for a numeric {@code p}</li>
 *   <li>{@code exp, sin, cos, tan} of an affine argument</li>
 * </ol>
 */
public final class Integrator {

    private Integrator() {}

    public static Optional<Expr> integrate(Expr node, Symbol v) {
        Expr result = antiderivative(node, v);
        return result == null ? Optional.empty() : Optional.of(Simplifier.simplify(result));
    }

    private static Expr antiderivative(Expr node, Symbol v) {
        Expr var = Expr.var(v);
        if (!node.dependsOn(v)) return mul(node, var);
        if (node.isVar(v)) return div(pow(var, Expr.num(2)), Expr.num(2));

        if (node instanceof Expr.Neg n) {
            Expr inner = antiderivative(n.argument(), v);
            return inner == null ? null : negate(inner);
        }
        if (node instanceof Expr.Call c) return function(c, v);

        Expr.Binary b = (Expr.Binary) node;
        Expr left = b.left();
        Expr right = b.right();
        switch (b.op()) {
            case ADD, SUB -> {
                Expr l = antiderivative(left, v);
                Expr r = antiderivative(right, v);
                if (l == null || r == null) return null;
                return b.op() == Operator.ADD ? add(l, r) : sub(l, r);
            }
            case MUL -> {
                if (!left.dependsOn(v)) {
                    Expr r = antiderivative(right, v);
                    return r == null ? null : mul(left, r);
                }
                if (!right.dependsOn(v)) {
                    Expr l = antiderivative(left, v);
                    return l == null ? null : mul(right, l);
                }
                return null;
            }
            case DIV -> {
                return quotient(left, right, v);
            }
            case POW -> {
                if (!left.isVar(v) || !(right instanceof Expr.Num p)) return null;
                if (Math.abs(p.value() + 1) < EPSILON) {
                    return call(MathFunction.LN, call(MathFunction.ABS, var));
                }
                Expr exponent = Expr.num(p.value() + 1);
                return div(pow(var, exponent), exponent);
            }
            default -> {
                return null;
            }
        }
    }

    private static Expr quotient(Expr numerator, Expr denominator, Symbol v) {
        if (!denominator.dependsOn(v)) {
            Expr inner = antiderivative(numerator, v);
            return inner == null ? null : div(inner, denominator);
        }
        if (numerator.dependsOn(v)) return null;

        // c / (a*v + b)  ->  (c/a) * ln|a*v + b|
        LinearForm lin = AffineMatcher.match(denominator, v).orElse(null);
        if (lin == null || lin.isConstant()) return null;
        Expr factor = div(numerator, Expr.num(lin.a()));
        return mul(factor, call(MathFunction.LN, call(MathFunction.ABS, denominator)));
    }

    private static Expr function(Expr.Call c, Symbol v) {
        LinearForm lin = AffineMatcher.match(c.argument(), v).orElse(null);
        if (lin == null || lin.isConstant()) return null;

        Expr arg = c.argument();
        Expr a = Expr.num(lin.a());
        return switch (c.function()) {
            case EXP -> div(call(MathFunction.EXP, arg), a);
            case SIN -> div(negate(call(MathFunction.COS, arg)), a);
            case COS -> div(call(MathFunction.SIN, arg), a);
            case TAN -> div(negate(call(MathFunction.LN, call(MathFunction.ABS, call(MathFunction.COS, arg)))), a);
            default -> null;
        };
    }
}
