package com.exprsolve.expr;

import java.util.List;

public class NumericOperations {

    public static final String NEGATE = "~";

    public static void register(OperationRegistry registry) {
        // Operators
        registry.registerOperator("+",
                new OperatorOperation("+", 2, 1, args -> args.get(0).add(args.get(1))));
        registry.registerOperator("-",
                new OperatorOperation("-", 2, 1, args -> args.get(0).subtract(args.get(1))));
        registry.registerOperator("*",
                new OperatorOperation("*", 2, 2, args -> args.get(0).multiply(args.get(1))));
        registry.registerOperator("/",
                new OperatorOperation("/", 2, 2, args -> args.get(0).divide(args.get(1))));

        // Unary minus, produced by the tokenizer when no operand precedes '-'
        registry.registerOperator(NEGATE,
                new OperatorOperation(NEGATE, 1, 10, args -> args.get(0).negate()));

        // Functions
        registry.registerFunction("log", new FunctionOperation("log", 1, args -> {
            double value = get(args, 0);
            if (value < Polynomial.EPSILON) {
                throw new ExpressionException(ErrorKind.DOMAIN_ERROR,
                        "Can't take logarithm of a number less than or equal to 0");
            }
            return Polynomial.constant(Math.log(value));
        }));
        registry.registerFunction("max", new FunctionOperation("max", 2,
                args -> Polynomial.constant(Math.max(get(args, 0), get(args, 1)))));
        registry.registerFunction("min", new FunctionOperation("min", 2,
                args -> Polynomial.constant(Math.min(get(args, 0), get(args, 1)))));
        registry.registerFunction("pow", new FunctionOperation("pow", 2,
                args -> Polynomial.constant(Math.pow(get(args, 0), get(args, 1)))));
        registry.registerFunction("sin", new FunctionOperation("sin", 1,
                args -> Polynomial.constant(Math.sin(get(args, 0)))));
        registry.registerFunction("cos", new FunctionOperation("cos", 1,
                args -> Polynomial.constant(Math.cos(get(args, 0)))));
    }

    private static double get(List<Polynomial> args, int index) {
        return args.get(index).constantTerm();
    }
}
