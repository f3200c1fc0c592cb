package com.exprsolve.expr;

import com.exprsolve.util.LoggingUtil;
import com.exprsolve.util.SolverConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point of the pipeline. An expression without {@code x} and without
 * '=' is evaluated to a number; an equation in {@code x} with exactly one '='
 * is rewritten as {@code left - right} and solved for its root.
 */
public class ExpressionSolver {

    static final String TOKENIZER_PREFIX = "Error tokenizing expression: ";
    static final String BUILDER_PREFIX = "Error building postfix sequence: ";
    static final String EVALUATOR_PREFIX = "Error evaluating postfix sequence: ";

    private final OperationRegistry registry = new OperationRegistry();
    private final PostfixBuilder builder = new PostfixBuilder(registry);
    private final PostfixEvaluator evaluator = new PostfixEvaluator();
    private final int significantDigits;

    public ExpressionSolver() {
        this(new SolverConfig());
    }

    public ExpressionSolver(SolverConfig config) {
        NumericOperations.register(registry);
        config.getFunctionAliases().forEach((alias, target) -> {
            try {
                registry.registerAlias(alias, target);
            } catch (IllegalArgumentException e) {
                LoggingUtil.warn("Skipping function alias: " + e.getMessage());
            }
        });
        this.significantDigits = config.getSignificantDigits();
    }

    public static void main(String[] args) {
        SolverConfig config = loadConfiguration(System.getProperty(SolverConfig.CONFIG_PROPERTY));
        LoggingUtil.initialize(config);

        run(args, System.out, new ExpressionSolver(config));
    }

    /**
     * Loads the bundled defaults, then the override file. A file that cannot
     * be read is logged and skipped, leaving whatever loaded before it.
     */
    static SolverConfig loadConfiguration(String overridePath) {
        SolverConfig config = new SolverConfig();
        try {
            config.loadFromResource(SolverConfig.DEFAULT_RESOURCE);
        } catch (IOException e) {
            LoggingUtil.error("Error loading bundled solver configuration, using built-in defaults: "
                    + e.getMessage(), e);
        }
        if (overridePath != null && !overridePath.isEmpty()) {
            try {
                config.loadFromFile(overridePath);
            } catch (IOException e) {
                LoggingUtil.error("Error loading solver configuration " + overridePath
                        + ", keeping bundled defaults: " + e.getMessage(), e);
            }
        }
        return config;
    }

    /**
     * Command line behaviour: all arguments are joined without a separator
     * and evaluated as one expression.
     */
    static void run(String[] args, PrintStream out, ExpressionSolver solver) {
        if (args.length == 0) {
            out.println("Usage: expression-solver \"expression\"");
            out.println("Example: expression-solver 3 + 4*5");
            return;
        }

        String expression = String.join("", args);
        LoggingUtil.info("Evaluating expression: " + expression);
        out.println("Result: " + solver.evaluate(expression));
    }

    public OperationRegistry getRegistry() {
        return registry;
    }

    /**
     * Evaluates or solves the expression and renders the answer. Failures are
     * returned as their message instead of being thrown.
     */
    public String evaluate(String expression) {
        SolverResult result = compute(expression);
        if (result.isSuccess()) {
            return ResultFormatter.format(result.getValue(), significantDigits);
        }
        return result.getMessage();
    }

    public SolverResult compute(String expression) {
        try {
            List<Token> tokens = tokenize(expression);
            boolean equation = isEquation(tokens);
            return SolverResult.success(expression, equation, solve(tokens, equation));
        } catch (ExpressionException e) {
            LoggingUtil.debug("Failed to evaluate [" + expression + "]: " + e.getKind() + " " + e.getMessage());
            return SolverResult.failure(expression, e);
        }
    }

    private List<Token> tokenize(String expression) {
        try {
            List<Token> tokens = new Tokenizer(expression).tokenize();
            if (LoggingUtil.isDebugEnabled()) {
                LoggingUtil.debug("Tokens: " + tokens);
            }
            return tokens;
        } catch (ExpressionException e) {
            throw e.withPrefix(TOKENIZER_PREFIX);
        }
    }

    /**
     * Decides the mode: true for an equation to solve, false for a constant
     * expression.
     */
    private boolean isEquation(List<Token> tokens) {
        int equalSigns = 0;
        boolean containsVariable = false;
        for (Token token : tokens) {
            if (token.is(TokenType.EQUALS)) equalSigns++;
            if (token.is(TokenType.VARIABLE)) containsVariable = true;
        }

        if (equalSigns > 1) {
            throw new ExpressionException(ErrorKind.TOO_MANY_EQUALS_SIGNS, "Expression contains too many equal signs");
        }
        if (containsVariable != (equalSigns == 1)) {
            throw new ExpressionException(ErrorKind.INCONSISTENT_EQUATION_FORM,
                    "Expression must contain both a variable and equal sign or neither");
        }
        return containsVariable;
    }

    private double solve(List<Token> tokens, boolean equation) {
        // left = right becomes left - right, whose root is the answer
        List<Token> rewritten = tokens.stream()
                .map(t -> t.is(TokenType.EQUALS) ? new Token("-", TokenType.OPERATOR) : t)
                .collect(Collectors.toList());

        List<PostfixNode> postfix;
        try {
            postfix = builder.build(rewritten);
        } catch (ExpressionException e) {
            throw e.withPrefix(BUILDER_PREFIX);
        }
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Postfix: " + postfix);
        }

        Polynomial result;
        try {
            result = evaluator.evaluate(postfix);
        } catch (ExpressionException e) {
            throw e.withPrefix(EVALUATOR_PREFIX);
        }

        if (!equation) {
            return result.constantTerm();
        }
        LoggingUtil.debug("Final polynomial: " + Arrays.toString(result.coefficients()));
        return result.solveLinear();
    }
}
