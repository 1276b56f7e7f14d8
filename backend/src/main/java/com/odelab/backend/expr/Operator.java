package com.odelab.backend.expr;

import java.util.Map;
import java.util.function.DoubleBinaryOperator;

public enum Operator {
    ADD('+', 1, false, (a, b) -> a + b),
    SUB('-', 1, false, (a, b) -> a - b),
    MUL('*', 2, false, (a, b) -> a * b),
    DIV('/', 2, false, (a, b) -> a / b),
    POW('^', 3, true, Math::pow);

    public static final int NEGATION_PRECEDENCE = 4;

    private static final Map<Character, Operator> BY_SYMBOL = Map.of(
            '+', ADD,
            '-', SUB,
            '*', MUL,
            '/', DIV,
            '^', POW
    );

    private final char symbol;
    private final int precedence;
    private final boolean rightAssociative;
    private final DoubleBinaryOperator fn;

    Operator(char symbol, int precedence, boolean rightAssociative, DoubleBinaryOperator fn) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
        this.fn = fn;
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    public boolean groupsLeftOnly() {
        return this == SUB || this == DIV || this == POW;
    }

    public double apply(double left, double right) {
        return fn.applyAsDouble(left, right);
    }

    public static Operator fromSymbol(char c) {
        return BY_SYMBOL.get(c);
    }
}
