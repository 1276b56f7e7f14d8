package com.odelab.backend.numeric;

import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.ExprEvaluator;

@FunctionalInterface
public interface DerivativeFunction {

    double slope(double x, double y);

    /** Evaluates {@code rhs}; any non-finite value comes back as NaN. */
    static DerivativeFunction of(Expr rhs) {
        return (x, y) -> {
            double v = ExprEvaluator.evaluate(rhs, x, y);
            return Double.isFinite(v) ? v : Double.NaN;
        };
    }
}
