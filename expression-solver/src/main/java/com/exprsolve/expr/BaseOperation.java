package com.exprsolve.expr;

import java.util.List;

public abstract class BaseOperation implements Operation {

    private final String identifier;
    private final int arity;
    private final int precedence;
    private final NumericOperation implementation;

    protected BaseOperation(String identifier, int arity, int precedence, NumericOperation implementation) {
        this.identifier = identifier;
        this.arity = arity;
        this.precedence = precedence;
        this.implementation = implementation;
    }

    @Override
    public String getIdentifier() {
        return identifier;
    }

    @Override
    public int getArity() {
        return arity;
    }

    @Override
    public int getPrecedence() {
        return precedence;
    }

    @Override
    public Polynomial apply(List<Polynomial> args) {
        checkArity(args);
        return implementation.apply(args);
    }

    protected void checkArity(List<Polynomial> args) {
        if (args.size() != arity) {
            throw new ExpressionException(ErrorKind.INSUFFICIENT_OPERANDS,
                    "Invalid number of parameters for " + identifier);
        }
    }

    @Override
    public String toString() {
        return identifier;
    }
}
