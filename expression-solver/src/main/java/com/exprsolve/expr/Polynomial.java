package com.exprsolve.expr;

import java.util.Arrays;

/**
 * Immutable polynomial in {@code x} holding coefficients by ascending power.
 * Only constants (one coefficient) and linear values (two coefficients) are
 * ever produced; the arithmetic rejects anything that would grow beyond that.
 *
 * <p>The legality thresholds below count coefficients, so a constant has
 * "degree 1" in the error messages.
 */
public final class Polynomial {

    public static final double EPSILON = 1e-6;

    private static final Polynomial X = new Polynomial(new double[]{0, 1});

    private final double[] coeff;

    private Polynomial(double[] coeff) {
        this.coeff = coeff;
    }

    public static Polynomial constant(double value) {
        return new Polynomial(new double[]{value});
    }

    public static Polynomial variable() {
        return X;
    }

    public static Polynomial of(double... coefficients) {
        if (coefficients.length == 0) {
            throw new IllegalArgumentException("Polynomial needs at least one coefficient");
        }
        return new Polynomial(coefficients.clone());
    }

    public Polynomial negate() {
        double[] result = coeff.clone();
        for (int i = 0; i < result.length; i++) {
            result[i] = -result[i];
        }
        return new Polynomial(result);
    }

    public Polynomial add(Polynomial right) {
        int size = Math.max(size(), right.size());
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            if (i < size()) result[i] += coeff[i];
            if (i < right.size()) result[i] += right.coeff[i];
        }
        return new Polynomial(result);
    }

    /**
     * Subtracts the constant term of {@code right} from this value. Higher terms
     * of either operand are not combined.
     */
    public Polynomial subtract(Polynomial right) {
        if (size() > 1 && right.size() > 1) {
            throw new ExpressionException(ErrorKind.UNSUPPORTED_OPERATION,
                    "Subtraction not supported for polynomials of degree >= 1");
        }
        double[] result = coeff.clone();
        result[0] -= right.coeff[0];
        return new Polynomial(result);
    }

    public Polynomial multiply(Polynomial right) {
        if (size() >= 2 && right.size() >= 2) {
            throw new ExpressionException(ErrorKind.UNSUPPORTED_OPERATION,
                    "Multiplication of polynomials of degree >= 2 not allowed");
        }
        if (size() >= right.size()) {
            return scale(coeff, right.coeff[0]);
        }
        return scale(right.coeff, coeff[0]);
    }

    public Polynomial divide(Polynomial right) {
        if (right.size() > 1) {
            throw new ExpressionException(ErrorKind.DIVISION_UNSUPPORTED,
                    "Division not supported by polynomials of degree >= 1");
        }
        if (Math.abs(right.coeff[0]) < EPSILON) {
            throw new ExpressionException(ErrorKind.DIVISION_BY_ZERO, "Can't divide polynomial by 0");
        }
        double[] result = coeff.clone();
        for (int i = 0; i < result.length; i++) {
            result[i] /= right.coeff[0];
        }
        return new Polynomial(result);
    }

    public boolean isConstant() {
        return coeff.length == 1;
    }

    public double constantTerm() {
        return coeff[0];
    }

    /** Number of stored coefficients. */
    public int size() {
        return coeff.length;
    }

    public double[] coefficients() {
        return coeff.clone();
    }

    /**
     * Returns the root of this linear polynomial.
     */
    public double solveLinear() {
        if (size() < 2 || Math.abs(coeff[1]) < EPSILON) {
            if (Math.abs(coeff[0]) < EPSILON) {
                throw new ExpressionException(ErrorKind.INFINITE_SOLUTIONS,
                        "Expression evaluates to 0, infinite number of solutions");
            }
            throw new ExpressionException(ErrorKind.NO_SOLUTION, "Constant can't equal 0, no solutions");
        }
        return -coeff[0] / coeff[1];
    }

    private static Polynomial scale(double[] values, double factor) {
        double[] result = values.clone();
        for (int i = 0; i < result.length; i++) {
            result[i] *= factor;
        }
        return new Polynomial(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polynomial other)) return false;
        return Arrays.equals(coeff, other.coeff);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coeff);
    }

    @Override
    public String toString() {
        return "Polynomial" + Arrays.toString(coeff);
    }
}
