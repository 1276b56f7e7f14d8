package com.odelab.backend.expr.integrate;

import com.odelab.backend.expr.Expr;

public record LinearForm(double a, Expr b) {
    public boolean isConstant() {
        return a == 0;
    }
}
