package com.exprsolve.util;

import com.exprsolve.expr.ExpressionSolver;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SolverConfigTest {

    @Test
    public void testDefaults() {
        SolverConfig config = new SolverConfig();
        assertEquals("INFO", config.getLoggingLevel());
        assertTrue(config.isConsoleLoggingEnabled());
        assertEquals(LoggingUtil.ConsoleOutputMode.ALL_TO_ERR, config.getConsoleOutputMode());
        assertFalse(config.isFileLoggingEnabled());
        assertEquals(6, config.getSignificantDigits());
        assertTrue(config.getFunctionAliases().isEmpty());
    }

    @Test
    public void testBundledConfiguration() throws Exception {
        SolverConfig config = SolverConfig.load(null);
        assertEquals(6, config.getSignificantDigits());
        assertEquals("log", config.getFunctionAliases().get("ln"));
    }

    @Test
    public void testLoadFromFileOverridesDefaults() throws Exception {
        SolverConfig config = new SolverConfig("src/test/resources/solver-config-test.json");

        assertEquals("WARNING", config.getLoggingLevel());
        assertEquals(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR, config.getConsoleOutputMode());
        assertEquals(4, config.getSignificantDigits());
        assertEquals(Map.of("power", "pow", "maximum", "max"), config.getFunctionAliases());
        // untouched keys keep their defaults
        assertFalse(config.isFileLoggingEnabled());
        assertEquals("expression-solver.log", config.getLogFileName());
    }

    @Test
    public void testOverrideFileLayersOnBundledDefaults() throws Exception {
        SolverConfig config = SolverConfig.load("src/test/resources/solver-config-test.json");

        assertEquals(4, config.getSignificantDigits());
        assertEquals("log", config.getFunctionAliases().get("ln"));
        assertEquals("pow", config.getFunctionAliases().get("power"));
    }

    @Test
    public void testMissingFileKeepsDefaults() throws Exception {
        SolverConfig config = new SolverConfig("does/not/exist.json");
        assertEquals(6, config.getSignificantDigits());
        assertEquals("INFO", config.getLoggingLevel());
    }

    @Test
    public void testConfiguredSolver() throws Exception {
        SolverConfig config = new SolverConfig("src/test/resources/solver-config-test.json");
        ExpressionSolver solver = new ExpressionSolver(config);

        assertEquals("1.414", solver.evaluate("power(2, 0.5)"));
        assertEquals("7", solver.evaluate("maximum(3, 7)"));
    }

    @Test
    public void testLoggingFollowsConfiguration() throws Exception {
        SolverConfig config = new SolverConfig("src/test/resources/solver-config-test.json");
        LoggingUtil.initialize(config);
        try {
            assertFalse(LoggingUtil.isDebugEnabled());
            assertEquals(java.util.logging.Level.WARNING, LoggingUtil.getCurrentLevel());

            config.setLoggingLevel("DEBUG");
            LoggingUtil.initialize(config);
            assertTrue(LoggingUtil.isDebugEnabled());
        } finally {
            LoggingUtil.initialize(new SolverConfig());
        }
    }

    @Test
    public void testSignificantDigitsValidated() {
        SolverConfig config = new SolverConfig();
        assertThrows(IllegalArgumentException.class, () -> config.setSignificantDigits(0));
        assertThrows(IllegalArgumentException.class, () -> config.setSignificantDigits(18));
        assertEquals(6, config.getSignificantDigits());

        config.setSignificantDigits(17);
        assertEquals(17, config.getSignificantDigits());
    }

    @Test
    public void testFunctionAliasesAreReadOnly() throws Exception {
        SolverConfig config = SolverConfig.load(null);
        assertThrows(UnsupportedOperationException.class, () -> config.getFunctionAliases().put("tg", "tan"));
    }
}
