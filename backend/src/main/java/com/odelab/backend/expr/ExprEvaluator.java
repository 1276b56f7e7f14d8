package com.odelab.backend.expr;

/**
 * Numeric evaluation of a tree with both variables bound.
 */
public final class ExprEvaluator implements ExprVisitor<Double> {

    private final double x;
    private final double y;

    private ExprEvaluator(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /** Domain errors surface as NaN or infinities, never as exceptions. */
    public static double evaluate(Expr node, double x, double y) {
        return node.accept(new ExprEvaluator(x, y));
    }

    @Override
    public Double visitNum(Expr.Num n) {
        return n.value();
    }

    @Override
    public Double visitVar(Expr.Var v) {
        return v.symbol() == Symbol.X ? x : y;
    }

    @Override
    public Double visitNeg(Expr.Neg n) {
        return -n.argument().accept(this);
    }

    @Override
    public Double visitCall(Expr.Call c) {
        return c.function().apply(c.argument().accept(this));
    }

    @Override
    public Double visitBinary(Expr.Binary b) {
        return b.op().apply(b.left().accept(this), b.right().accept(this));
    }
}
