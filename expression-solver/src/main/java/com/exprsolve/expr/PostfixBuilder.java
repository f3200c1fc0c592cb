package com.exprsolve.expr;

import com.exprsolve.util.LoggingUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts an infix token sequence to postfix order with the shunting-yard
 * algorithm. Operators of equal precedence are popped before the incoming
 * one, so binary operators associate to the left.
 */
public class PostfixBuilder {

    private final OperationRegistry registry;

    public PostfixBuilder(OperationRegistry registry) {
        this.registry = registry;
    }

    public List<PostfixNode> build(List<Token> tokens) {
        List<PostfixNode> output = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();

        for (Token token : tokens) {
            if (LoggingUtil.isDebugEnabled()) {
                LoggingUtil.debug("Processing token: " + token);
            }

            switch (token.getType()) {
                case WHITESPACE:
                    break;
                case NUMBER:
                    output.add(PostfixNode.value(Polynomial.constant(token.getValue())));
                    break;
                case VARIABLE:
                    output.add(PostfixNode.value(Polynomial.variable()));
                    break;
                case OPERATOR:
                    Operation incoming = resolve(token);
                    while (!stack.isEmpty() && stack.peek().is(TokenType.OPERATOR)) {
                        Operation top = resolve(stack.peek());
                        if (top.getPrecedence() < incoming.getPrecedence()) {
                            break;
                        }
                        output.add(PostfixNode.operation(top));
                        stack.pop();
                    }
                    stack.push(token);
                    break;
                case FUNCTION:
                case LEFT_PAREN:
                    stack.push(token);
                    break;
                case COMMA:
                    popUntilLeftParen(stack, output);
                    if (stack.isEmpty()) {
                        throw new ExpressionException(ErrorKind.MISMATCHED_PAREN,
                                "Invalid function declaration: missing left parentheses");
                    }
                    break;
                case RIGHT_PAREN:
                    popUntilLeftParen(stack, output);
                    if (stack.isEmpty()) {
                        throw new ExpressionException(ErrorKind.MISMATCHED_PAREN,
                                "Invalid parentheses: missing left parentheses");
                    }
                    stack.pop();
                    if (!stack.isEmpty() && stack.peek().is(TokenType.FUNCTION)) {
                        output.add(PostfixNode.operation(resolve(stack.pop())));
                    }
                    break;
                default:
                    throw new ExpressionException(ErrorKind.UNKNOWN_TOKEN, "Unknown token: " + token.getText());
            }
        }

        while (!stack.isEmpty()) {
            Token token = stack.pop();
            if (token.is(TokenType.LEFT_PAREN) || token.is(TokenType.RIGHT_PAREN)) {
                throw new ExpressionException(ErrorKind.MISMATCHED_PAREN, "Mismatched parentheses");
            }
            output.add(PostfixNode.operation(resolve(token)));
        }

        return output;
    }

    private void popUntilLeftParen(Deque<Token> stack, List<PostfixNode> output) {
        while (!stack.isEmpty() && !stack.peek().is(TokenType.LEFT_PAREN)) {
            output.add(PostfixNode.operation(resolve(stack.pop())));
        }
    }

    private Operation resolve(Token token) {
        if (token.is(TokenType.OPERATOR)) {
            Operation op = registry.getOperator(token.getText());
            if (op == null) {
                throw new ExpressionException(ErrorKind.UNKNOWN_SYMBOL,
                        "Invalid mathematical operator " + token.getText());
            }
            return op;
        }
        if (token.is(TokenType.FUNCTION)) {
            Operation op = registry.getFunction(token.getText());
            if (op == null) {
                throw new ExpressionException(ErrorKind.UNKNOWN_SYMBOL,
                        "Invalid mathematical function " + token.getText());
            }
            return op;
        }
        throw new ExpressionException(ErrorKind.UNKNOWN_TOKEN, "Unknown token: " + token.getText());
    }
}
