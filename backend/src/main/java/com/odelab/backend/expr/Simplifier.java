package com.odelab.backend.expr;

/**
 * Bottom-up canonicalization: constant folding plus the additive,
 * multiplicative and power identities. Function calls are never folded.
 * <p>
 * The builder methods ({@link #add}, {@link #mul}, ...) construct a node and
 * simplify it in one go; symbolic code uses them for every new node.
 */
public final class Simplifier {

    public static final double EPSILON = 1e-9;

    private static final ExprVisitor<Expr> PASS = new ExprVisitor<>() {
        @Override
        public Expr visitNum(Expr.Num n) {
            return n;
        }

        @Override
        public Expr visitVar(Expr.Var v) {
            return v;
        }

        @Override
        public Expr visitNeg(Expr.Neg n) {
            Expr arg = n.argument().accept(this);
            if (arg instanceof Expr.Num num) return Expr.num(-num.value());
            return Expr.neg(arg);
        }

        @Override
        public Expr visitCall(Expr.Call c) {
            return Expr.call(c.function(), c.argument().accept(this));
        }

        @Override
        public Expr visitBinary(Expr.Binary b) {
            Expr left = b.left().accept(this);
            Expr right = b.right().accept(this);
            return rewrite(b.op(), left, right);
        }
    };

    private Simplifier() {}

    public static Expr simplify(Expr node) {
        return node.accept(PASS);
    }

    private static Expr rewrite(Operator op, Expr left, Expr right) {
        if (left instanceof Expr.Num l && right instanceof Expr.Num r) {
            return Expr.num(op.apply(l.value(), r.value()));
        }
        switch (op) {
            case ADD -> {
                if (isZero(left)) return right;
                if (isZero(right)) return left;
            }
            case SUB -> {
                if (isZero(right)) return left;
            }
            case MUL -> {
                if (isZero(left) || isZero(right)) return Expr.num(0);
                if (isOne(left)) return right;
                if (isOne(right)) return left;
            }
            case DIV -> {
                if (isZero(left)) return Expr.num(0);
                if (isOne(right)) return left;
            }
            case POW -> {
                if (isZero(right)) return Expr.num(1);
                if (isOne(right)) return left;
            }
        }
        return Expr.binary(op, left, right);
    }

    public static boolean isZero(Expr node) {
        return node instanceof Expr.Num n && Math.abs(n.value()) < EPSILON;
    }

    public static boolean isOne(Expr node) {
        return node instanceof Expr.Num n && Math.abs(n.value() - 1) < EPSILON;
    }

    public static Expr add(Expr a, Expr b) {
        return simplify(Expr.binary(Operator.ADD, a, b));
    }

    public static Expr sub(Expr a, Expr b) {
        return simplify(Expr.binary(Operator.SUB, a, b));
    }

    public static Expr mul(Expr a, Expr b) {
        return simplify(Expr.binary(Operator.MUL, a, b));
    }

    public static Expr div(Expr a, Expr b) {
        return simplify(Expr.binary(Operator.DIV, a, b));
    }

    public static Expr pow(Expr a, Expr b) {
        return simplify(Expr.binary(Operator.POW, a, b));
    }

    public static Expr negate(Expr a) {
        return simplify(Expr.neg(a));
    }

    public static Expr call(MathFunction function, Expr argument) {
        return simplify(Expr.call(function, argument));
    }
}
