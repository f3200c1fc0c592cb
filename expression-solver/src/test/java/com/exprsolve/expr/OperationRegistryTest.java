package com.exprsolve.expr;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class OperationRegistryTest {

    private OperationRegistry registry;

    @BeforeEach
    public void setup() {
        registry = new OperationRegistry();
        NumericOperations.register(registry);
    }

    @Test
    public void testBuiltInOperators() {
        assertEquals(1, registry.getOperator("+").getPrecedence());
        assertEquals(1, registry.getOperator("-").getPrecedence());
        assertEquals(2, registry.getOperator("*").getPrecedence());
        assertEquals(2, registry.getOperator("/").getPrecedence());

        Operation negate = registry.getOperator(NumericOperations.NEGATE);
        assertEquals(1, negate.getArity());
        assertTrue(negate.getPrecedence() > registry.getOperator("*").getPrecedence());

        assertNull(registry.getOperator("%"));
    }

    @Test
    public void testBuiltInFunctions() {
        assertEquals(Set.of("cos", "log", "max", "min", "pow", "sin"), registry.getFunctionNames());
        assertEquals(1, registry.getFunction("log").getArity());
        assertEquals(2, registry.getFunction("max").getArity());
        assertEquals(2, registry.getFunction("min").getArity());
        assertEquals(2, registry.getFunction("pow").getArity());
        assertEquals(1, registry.getFunction("sin").getArity());
        assertEquals(1, registry.getFunction("cos").getArity());
    }

    @Test
    public void testFunctionLookupIgnoresCase() {
        assertSame(registry.getFunction("max"), registry.getFunction("MAX"));
    }

    @Test
    public void testFunctionsRejectLinearArguments() {
        ExpressionException e = assertThrows(ExpressionException.class,
                () -> registry.getFunction("sin").apply(List.of(Polynomial.variable())));
        assertEquals(ErrorKind.NON_CONSTANT_ARGUMENT, e.getKind());
        assertEquals("Can't use sin on polynomials of degree >= 2", e.getMessage());
    }

    @Test
    public void testArityChecked() {
        ExpressionException e = assertThrows(ExpressionException.class,
                () -> registry.getFunction("max").apply(List.of(Polynomial.constant(1))));
        assertEquals(ErrorKind.INSUFFICIENT_OPERANDS, e.getKind());
        assertEquals("Invalid number of parameters for max", e.getMessage());
    }

    @Test
    public void testLogDomain() {
        Operation log = registry.getFunction("log");
        assertEquals(Math.log(10), log.apply(List.of(Polynomial.constant(10))).constantTerm(), 1e-12);

        ExpressionException e = assertThrows(ExpressionException.class,
                () -> log.apply(List.of(Polynomial.constant(0))));
        assertEquals(ErrorKind.DOMAIN_ERROR, e.getKind());
    }

    @Test
    public void testOperatorsAcceptLinearOperands() {
        Polynomial result = registry.getOperator("+").apply(List.of(Polynomial.variable(), Polynomial.constant(2)));
        assertEquals(Polynomial.of(2, 1), result);
    }

    @Test
    public void testAliases() {
        registry.registerAlias("ln", "log");
        assertSame(registry.getFunction("log"), registry.getFunction("ln"));
        assertTrue(registry.containsFunction("LN"));
    }

    @Test
    public void testAliasToUnknownFunctionRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.registerAlias("foo", "bar"));
    }

    @Test
    public void testCustomFunctionRegistration() {
        registry.registerFunction("tan",
                new FunctionOperation("tan", 1, args -> Polynomial.constant(Math.tan(args.get(0).constantTerm()))),
                "tangent");

        assertTrue(registry.containsFunction("tan"));
        assertSame(registry.getFunction("tan"), registry.getFunction("tangent"));
        assertEquals(Math.tan(0.5),
                registry.getFunction("tan").apply(List.of(Polynomial.constant(0.5))).constantTerm(), 1e-12);
    }

    @Test
    public void testFunctionReplacesAliasOfSameName() {
        registry.registerAlias("ln", "log");
        Operation ln = new FunctionOperation("ln", 1, args -> Polynomial.constant(-1));
        registry.registerFunction("ln", ln);

        assertSame(ln, registry.getFunction("ln"));
        assertNotSame(registry.getFunction("log"), registry.getFunction("ln"));
    }
}
