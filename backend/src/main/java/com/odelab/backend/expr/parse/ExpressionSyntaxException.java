package com.odelab.backend.expr.parse;

public class ExpressionSyntaxException extends IllegalArgumentException {
    public ExpressionSyntaxException(String message) {
        super(message);
    }
}
