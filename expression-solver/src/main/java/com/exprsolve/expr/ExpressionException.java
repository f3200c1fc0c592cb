package com.exprsolve.expr;

/**
 * Typed failure raised anywhere in the evaluation pipeline. The message is
 * human readable and is what {@link ExpressionSolver#evaluate(String)} returns
 * in place of a number.
 */
public class ExpressionException extends RuntimeException {

    private final ErrorKind kind;

    public ExpressionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExpressionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Re-wraps this error with a stage prefix, keeping its kind.
     */
    public ExpressionException withPrefix(String prefix) {
        return new ExpressionException(kind, prefix + getMessage(), this);
    }
}
