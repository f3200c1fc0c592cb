package com.exprsolve.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits raw expression text into tokens, left to right.
 *
 * <p>A '-' is read as binary subtraction only when an operand (number,
 * variable or closing parenthesis) was the last real token; otherwise it
 * becomes the unary negation operator {@code ~}. The letter {@code x} is the
 * variable unless it starts a longer name such as a function call.
 */
public class Tokenizer {

    public static final char VARIABLE = 'x';

    private final String expr;
    private int pos = 0;
    private boolean expectOperator = false;

    public Tokenizer(String expr) {
        this.expr = expr;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < expr.length()) {
            Token token = nextToken();
            tokens.add(token);

            if (token.is(TokenType.NUMBER) || token.is(TokenType.VARIABLE) || token.is(TokenType.RIGHT_PAREN)) {
                expectOperator = true;
            } else if (!token.is(TokenType.WHITESPACE)) {
                expectOperator = false;
            }
        }
        return tokens;
    }

    private Token nextToken() {
        char c = current();

        if (c == ' ' || c == '\t') {
            pos++;
            return new Token(String.valueOf(c), TokenType.WHITESPACE);
        }
        if (c == ',') {
            pos++;
            return new Token(",", TokenType.COMMA);
        }
        if (isDigit(c)) {
            return parseNumber();
        }
        if (c == VARIABLE && !(remaining() > 2 && isLetter(expr.charAt(pos + 1)))) {
            pos++;
            return new Token(String.valueOf(c), TokenType.VARIABLE);
        }
        if (isLetter(c)) {
            return parseFunctionName();
        }
        if (c == '(') {
            pos++;
            return new Token("(", TokenType.LEFT_PAREN);
        }
        if (c == ')') {
            pos++;
            return new Token(")", TokenType.RIGHT_PAREN);
        }
        if (c == '=') {
            pos++;
            return new Token("=", TokenType.EQUALS);
        }
        if (c == '-' && !expectOperator) {
            pos++;
            return new Token(NumericOperations.NEGATE, TokenType.OPERATOR);
        }
        if (c == '+' || c == '-' || c == '*' || c == '/') {
            pos++;
            return new Token(String.valueOf(c), TokenType.OPERATOR);
        }
        throw new ExpressionException(ErrorKind.INVALID_OPERATOR, "Invalid operator");
    }

    private Token parseNumber() {
        int start = pos;
        int end = pos + 1;
        int dots = 0;
        while (end < expr.length()) {
            char c = expr.charAt(end);
            if (isLetter(c) || c == '(') {
                throw new ExpressionException(ErrorKind.MALFORMED_NUMBER,
                        "Invalid floating number: contains invalid characters");
            }
            if (!isDigit(c) && c != '.') {
                break;
            }
            if (c == '.') dots++;
            end++;
        }

        if (dots > 1) {
            throw new ExpressionException(ErrorKind.MALFORMED_NUMBER, "Invalid floating number: too many dots");
        }

        String text = expr.substring(start, end);
        pos = end;
        return new Token(text, TokenType.NUMBER, Double.parseDouble(text));
    }

    private Token parseFunctionName() {
        int start = pos;
        int end = pos + 1;
        while (end < expr.length() && isLetter(expr.charAt(end))) {
            end++;
        }
        if (end < expr.length()) {
            char next = expr.charAt(end);
            if (next != '(' && next != ' ' && next != '\t') {
                throw new ExpressionException(ErrorKind.INVALID_FUNCTION_NAME, "Invalid function definition");
            }
        }
        pos = end;
        return new Token(expr.substring(start, end), TokenType.FUNCTION);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private int remaining() {
        return expr.length() - pos;
    }

    private char current() {
        return pos < expr.length() ? expr.charAt(pos) : '\0';
    }
}
