package com.exprsolve.expr;

/**
 * Infix (or synthetic prefix) operator. Operators accept linear operands and
 * leave legality checks to {@link Polynomial}.
 */
public class OperatorOperation extends BaseOperation {

    public OperatorOperation(String symbol, int arity, int precedence, NumericOperation implementation) {
        super(symbol, arity, precedence, implementation);
    }
}
