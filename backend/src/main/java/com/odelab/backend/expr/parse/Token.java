package com.odelab.backend.expr.parse;

import com.odelab.backend.expr.MathFunction;
import com.odelab.backend.expr.Operator;
import com.odelab.backend.expr.Symbol;

public record Token(
        Type type,
        double number,
        Symbol symbol,
        MathFunction function,
        Operator op
) {
    public enum Type {
        NUMBER,
        VARIABLE,
        FUNCTION,
        OPERATOR,
        NEGATE,     // unary minus
        COMMA,
        LPAREN,
        RPAREN
    }

    static Token number(double value) { return new Token(Type.NUMBER, value, null, null, null); }
    static Token variable(Symbol s) { return new Token(Type.VARIABLE, 0, s, null, null); }
    static Token function(MathFunction f) { return new Token(Type.FUNCTION, 0, null, f, null); }
    static Token operator(Operator op) { return new Token(Type.OPERATOR, 0, null, null, op); }
    static Token negate() { return new Token(Type.NEGATE, 0, null, null, null); }
    static Token of(Type type) { return new Token(type, 0, null, null, null); }

    boolean isOperatorLike() {
        return type == Type.OPERATOR || type == Type.NEGATE;
    }

    int precedence() {
        return type == Type.NEGATE ? Operator.NEGATION_PRECEDENCE : op.precedence();
    }

    boolean isRightAssociative() {
        return type == Type.NEGATE || op.isRightAssociative();
    }
}
