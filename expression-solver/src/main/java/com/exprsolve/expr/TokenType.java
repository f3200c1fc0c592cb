package com.exprsolve.expr;

public enum TokenType {
    WHITESPACE,
    COMMA,
    NUMBER,
    OPERATOR,
    FUNCTION,
    LEFT_PAREN,
    RIGHT_PAREN,
    VARIABLE,
    EQUALS
}
