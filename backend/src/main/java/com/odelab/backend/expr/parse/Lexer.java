package com.odelab.backend.expr.parse;

import com.odelab.backend.expr.MathFunction;
import com.odelab.backend.expr.Operator;
import com.odelab.backend.expr.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class Lexer {

    private static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "e", Math.E
    );

    private final String input;
    private int pos;
    private Token.Type prev;

    Lexer(String input) {
        this.input = input;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            Token t;
            if (isDigit(c)) {
                t = readNumber();
            } else if (isIdentStart(c)) {
                t = readIdentifier();
            } else if (c == ',') {
                pos++;
                t = Token.of(Token.Type.COMMA);
            } else if (c == '(') {
                pos++;
                t = Token.of(Token.Type.LPAREN);
            } else if (c == ')') {
                pos++;
                t = Token.of(Token.Type.RPAREN);
            } else if (Operator.fromSymbol(c) != null) {
                pos++;
                t = c == '-' && unaryPosition() ? Token.negate() : Token.operator(Operator.fromSymbol(c));
            } else {
                throw new ExpressionSyntaxException("Invalid character: " + c);
            }
            tokens.add(t);
            prev = t.type();
        }
        return tokens;
    }

    private boolean unaryPosition() {
        return prev == null
                || prev == Token.Type.OPERATOR
                || prev == Token.Type.NEGATE
                || prev == Token.Type.LPAREN
                || prev == Token.Type.COMMA;
    }

    private Token readNumber() {
        int start = pos;
        int dots = 0;
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            if (input.charAt(pos) == '.') dots++;
            pos++;
        }
        String text = input.substring(start, pos);
        if (dots > 1 || text.equals(".")) {
            throw new ExpressionSyntaxException("Invalid number: " + text);
        }
        return Token.number(Double.parseDouble(text));
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < input.length() && isIdentPart(input.charAt(pos))) pos++;
        String id = input.substring(start, pos);
        String lower = id.toLowerCase(Locale.ROOT);

        Double constant = CONSTANTS.get(lower);
        if (constant != null) return Token.number(constant);

        MathFunction fn = MathFunction.byName(lower);
        if (fn != null) return Token.function(fn);

        Symbol symbol = Symbol.fromText(lower);
        if (symbol != null) return Token.variable(symbol);

        throw new ExpressionSyntaxException("Unknown identifier: " + id);
    }

    private static boolean isDigit(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || (c >= '0' && c <= '9');
    }
}
