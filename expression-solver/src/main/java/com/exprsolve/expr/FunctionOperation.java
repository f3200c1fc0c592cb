package com.exprsolve.expr;

import java.util.List;

/**
 * Named function applied to a bracketed argument list. Functions are never
 * compared by precedence and only accept constant arguments.
 */
public class FunctionOperation extends BaseOperation {

    public FunctionOperation(String name, int arity, NumericOperation implementation) {
        super(name, arity, 0, implementation);
    }

    @Override
    public Polynomial apply(List<Polynomial> args) {
        checkArity(args);
        for (Polynomial arg : args) {
            if (!arg.isConstant()) {
                throw new ExpressionException(ErrorKind.NON_CONSTANT_ARGUMENT,
                        "Can't use " + getIdentifier() + " on polynomials of degree >= 2");
            }
        }
        return super.apply(args);
    }
}
