package com.exprsolve.expr;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ResultFormatterTest {

    @Test
    public void testIntegersHaveNoFraction() {
        assertEquals("13", ResultFormatter.format(13.0));
        assertEquals("-20", ResultFormatter.format(-20.0));
        assertEquals("100000", ResultFormatter.format(100000.0));
    }

    @Test
    public void testRoundsToSignificantDigits() {
        assertEquals("-0.347373", ResultFormatter.format(-0.34737264));
        assertEquals("3.14159", ResultFormatter.format(Math.PI));
        assertEquals("0.3", ResultFormatter.format(0.1 + 0.2));
        assertEquals("2.5", ResultFormatter.format(2.5));
    }

    @Test
    public void testScientificForLargeAndSmallMagnitudes() {
        assertEquals("1.23457e+06", ResultFormatter.format(1234567.0));
        assertEquals("1e+06", ResultFormatter.format(1e6));
        assertEquals("0.0001", ResultFormatter.format(0.0001));
        assertEquals("1e-05", ResultFormatter.format(0.00001));
        assertEquals("-2.5e-07", ResultFormatter.format(-2.5e-7));
    }

    @Test
    public void testSpecialValues() {
        assertEquals("nan", ResultFormatter.format(Double.NaN));
        assertEquals("inf", ResultFormatter.format(Double.POSITIVE_INFINITY));
        assertEquals("-inf", ResultFormatter.format(Double.NEGATIVE_INFINITY));
        assertEquals("0", ResultFormatter.format(-0.0));
    }

    @Test
    public void testCustomPrecision() {
        assertEquals("0.333", ResultFormatter.format(1.0 / 3, 3));
        assertEquals("1.4142", ResultFormatter.format(Math.sqrt(2), 5));
        assertEquals("1.2e+03", ResultFormatter.format(1234.0, 2));
    }
}
