package com.exprsolve.expr;

import java.util.List;

@FunctionalInterface
public interface NumericOperation {
    Polynomial apply(List<Polynomial> args);
}
