package com.odelab.backend.expr.parse;

import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.Simplifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard parser producing a simplified {@link Expr}.
 * <p>
 * Precedence: {@code + -} 1, {@code * /} 2, {@code ^} 3 (right), unary minus 4 (right).
 * Functions bind tighter than any operator and take the following argument.
 */
public final class ExpressionParser {

    /** Deeper trees are rejected so that the recursive tree walks stay within the stack. */
    public static final int MAX_DEPTH = 200;

    private ExpressionParser() {}

    public static Expr parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionSyntaxException("Expression is empty.");
        }
        String sanitized = text.replace('−', '-');
        List<Token> tokens = new Lexer(sanitized).tokenize();
        return Simplifier.simplify(build(toPostfix(tokens)));
    }

    static List<Token> toPostfix(List<Token> tokens) {
        List<Token> output = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();

        for (Token token : tokens) {
            switch (token.type()) {
                case NUMBER, VARIABLE -> output.add(token);
                case FUNCTION, LPAREN -> stack.push(token);
                case COMMA -> {
                    while (!stack.isEmpty() && stack.peek().type() != Token.Type.LPAREN) {
                        output.add(stack.pop());
                    }
                    if (stack.isEmpty()) throw unbalanced();
                }
                case OPERATOR, NEGATE -> {
                    while (!stack.isEmpty()) {
                        Token top = stack.peek();
                        if (top.type() == Token.Type.FUNCTION) {
                            output.add(stack.pop());
                            continue;
                        }
                        if (top.isOperatorLike() && yieldsTo(token, top)) {
                            output.add(stack.pop());
                            continue;
                        }
                        break;
                    }
                    stack.push(token);
                }
                case RPAREN -> {
                    boolean found = false;
                    while (!stack.isEmpty()) {
                        Token top = stack.pop();
                        if (top.type() == Token.Type.LPAREN) {
                            found = true;
                            break;
                        }
                        output.add(top);
                    }
                    if (!found) throw unbalanced();
                    if (!stack.isEmpty() && stack.peek().type() == Token.Type.FUNCTION) {
                        output.add(stack.pop());
                    }
                }
            }
        }
        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top.type() == Token.Type.LPAREN || top.type() == Token.Type.RPAREN) throw unbalanced();
            output.add(top);
        }
        return output;
    }

    private static boolean yieldsTo(Token incoming, Token top) {
        if (incoming.isRightAssociative()) return incoming.precedence() < top.precedence();
        return incoming.precedence() <= top.precedence();
    }

    static Expr build(List<Token> postfix) {
        Deque<Expr> stack = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();

        for (Token token : postfix) {
            switch (token.type()) {
                case NUMBER -> push(stack, depths, Expr.num(token.number()), 1);
                case VARIABLE -> push(stack, depths, Expr.var(token.symbol()), 1);
                case NEGATE -> {
                    if (stack.isEmpty()) {
                        throw new ExpressionSyntaxException("Unary minus is missing its operand.");
                    }
                    push(stack, depths, Expr.neg(stack.pop()), depths.pop() + 1);
                }
                case FUNCTION -> {
                    if (stack.isEmpty()) {
                        throw new ExpressionSyntaxException(
                                "Function " + token.function().functionName() + " has no argument.");
                    }
                    push(stack, depths, Expr.call(token.function(), stack.pop()), depths.pop() + 1);
                }
                case OPERATOR -> {
                    if (stack.size() < 2) {
                        throw new ExpressionSyntaxException(
                                "Operator " + token.op().symbol() + " is missing an operand.");
                    }
                    Expr right = stack.pop();
                    Expr left = stack.pop();
                    int depth = Math.max(depths.pop(), depths.pop()) + 1;
                    push(stack, depths, Expr.binary(token.op(), left, right), depth);
                }
                default -> throw new ExpressionSyntaxException("Unexpected token in expression.");
            }
        }
        if (stack.size() != 1) {
            throw new ExpressionSyntaxException("Expression structure is invalid.");
        }
        return stack.pop();
    }

    private static void push(Deque<Expr> stack, Deque<Integer> depths, Expr node, int depth) {
        if (depth > MAX_DEPTH) {
            throw new ExpressionSyntaxException("Expression is nested too deeply.");
        }
        stack.push(node);
        depths.push(depth);
    }

    private static ExpressionSyntaxException unbalanced() {
        return new ExpressionSyntaxException("Mismatched parentheses.");
    }
}
