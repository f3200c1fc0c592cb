package com.exprsolve.expr;

import java.util.List;

public interface Operation {
    String getIdentifier();
    int getArity();
    int getPrecedence();
    Polynomial apply(List<Polynomial> args);
}
