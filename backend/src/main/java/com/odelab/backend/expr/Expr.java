package com.odelab.backend.expr;

import java.util.Objects;

public sealed interface Expr permits Expr.Num, Expr.Var, Expr.Neg, Expr.Call, Expr.Binary {

    record Num(double value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNum(this);
        }
    }

    record Var(Symbol symbol) implements Expr {
        public Var {
            Objects.requireNonNull(symbol, "symbol");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVar(this);
        }
    }

    record Neg(Expr argument) implements Expr {
        public Neg {
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNeg(this);
        }
    }

    record Call(MathFunction function, Expr argument) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Binary(Operator op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    <R> R accept(ExprVisitor<R> visitor);

    static Expr num(double value) { return new Num(value); }
    static Expr var(Symbol symbol) { return new Var(symbol); }
    static Expr neg(Expr argument) { return new Neg(argument); }
    static Expr call(MathFunction function, Expr argument) { return new Call(function, argument); }
    static Expr binary(Operator op, Expr left, Expr right) { return new Binary(op, left, right); }

    default boolean isVar(Symbol symbol) {
        return this instanceof Var v && v.symbol() == symbol;
    }

    /** True when {@code symbol} occurs anywhere in this tree. */
    default boolean dependsOn(Symbol symbol) {
        return accept(new ExprVisitor<Boolean>() {
            @Override
            public Boolean visitNum(Num n) {
                return false;
            }

            @Override
            public Boolean visitVar(Var v) {
                return v.symbol() == symbol;
            }

            @Override
            public Boolean visitNeg(Neg n) {
                return n.argument().accept(this);
            }

            @Override
            public Boolean visitCall(Call c) {
                return c.argument().accept(this);
            }

            @Override
            public Boolean visitBinary(Binary b) {
                return b.left().accept(this) || b.right().accept(this);
            }
        });
    }

    default String render() {
        return ExprRenderer.render(this);
    }
}
