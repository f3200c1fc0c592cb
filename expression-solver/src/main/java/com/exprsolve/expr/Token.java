package com.exprsolve.expr;

public final class Token {

    private final String text;
    private final TokenType type;
    private final double value;

    public Token(String text, TokenType type) {
        this(text, type, 0);
    }

    public Token(String text, TokenType type, double value) {
        this.text = text;
        this.type = type;
        this.value = value;
    }

    public String getText() {
        return text;
    }

    public TokenType getType() {
        return type;
    }

    /** Parsed value, meaningful for {@link TokenType#NUMBER} only. */
    public double getValue() {
        return value;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
