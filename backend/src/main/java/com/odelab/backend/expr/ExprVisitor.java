package com.odelab.backend.expr;

public interface ExprVisitor<R> {
    R visitNum(Expr.Num n);

    R visitVar(Expr.Var v);

    R visitNeg(Expr.Neg n);

    R visitCall(Expr.Call c);

    R visitBinary(Expr.Binary b);
}
