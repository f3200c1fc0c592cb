package com.exprsolve.expr;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders answers in general notation with a fixed number of significant
 * digits: plain decimals with trailing zeros dropped, switching to
 * scientific form for very small or very large magnitudes.
 */
public class ResultFormatter {

    public static final int DEFAULT_SIGNIFICANT_DIGITS = 6;

    public static String format(double value) {
        return format(value, DEFAULT_SIGNIFICANT_DIGITS);
    }

    public static String format(double value, int significantDigits) {
        if (Double.isNaN(value)) return "nan";
        if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
        // also folds -0.0
        if (value == 0) return "0";

        BigDecimal rounded = new BigDecimal(value).round(new MathContext(significantDigits, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;

        if (exponent < -4 || exponent >= significantDigits) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            return mantissa + "e" + (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
