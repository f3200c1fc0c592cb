package com.exprsolve.expr;

/**
 * Outcome of one evaluation: either a numeric answer or the error that
 * stopped the pipeline.
 */
public final class SolverResult {

    private final String expression;
    private final boolean equation;
    private final double value;
    private final ExpressionException error;

    private SolverResult(String expression, boolean equation, double value, ExpressionException error) {
        this.expression = expression;
        this.equation = equation;
        this.value = value;
        this.error = error;
    }

    public static SolverResult success(String expression, boolean equation, double value) {
        return new SolverResult(expression, equation, value, null);
    }

    public static SolverResult failure(String expression, ExpressionException error) {
        return new SolverResult(expression, false, Double.NaN, error);
    }

    public String getExpression() {
        return expression;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** True when the answer is the root of an equation in x. */
    public boolean isEquation() {
        return equation;
    }

    public double getValue() {
        if (error != null) {
            throw new IllegalStateException("No value for failed evaluation: " + error.getMessage());
        }
        return value;
    }

    public ExpressionException getError() {
        return error;
    }

    public ErrorKind getErrorKind() {
        return error == null ? null : error.getKind();
    }

    public String getMessage() {
        return error == null ? null : error.getMessage();
    }
}
