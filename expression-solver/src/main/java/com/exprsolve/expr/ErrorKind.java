package com.exprsolve.expr;

/**
 * Classifies every failure the solver can report, grouped by the stage
 * that raises it.
 */
public enum ErrorKind {
    MALFORMED_NUMBER(Category.LEXICAL),
    INVALID_FUNCTION_NAME(Category.LEXICAL),
    INVALID_OPERATOR(Category.LEXICAL),

    MISMATCHED_PAREN(Category.STRUCTURAL),
    UNKNOWN_TOKEN(Category.STRUCTURAL),
    UNKNOWN_SYMBOL(Category.STRUCTURAL),

    INSUFFICIENT_OPERANDS(Category.EVALUATION),
    EXCESS_OPERANDS(Category.EVALUATION),

    UNSUPPORTED_OPERATION(Category.ALGEBRAIC),
    DIVISION_UNSUPPORTED(Category.ALGEBRAIC),
    DIVISION_BY_ZERO(Category.ALGEBRAIC),
    NON_CONSTANT_ARGUMENT(Category.ALGEBRAIC),
    DOMAIN_ERROR(Category.ALGEBRAIC),

    TOO_MANY_EQUALS_SIGNS(Category.SEMANTIC),
    INCONSISTENT_EQUATION_FORM(Category.SEMANTIC),
    NO_SOLUTION(Category.SEMANTIC),
    INFINITE_SOLUTIONS(Category.SEMANTIC);

    public enum Category {
        /** Raised by the tokenizer. */
        LEXICAL,
        /** Raised while building the postfix sequence. */
        STRUCTURAL,
        /** Raised by the postfix stack machine. */
        EVALUATION,
        /** Raised by polynomial arithmetic or function application. */
        ALGEBRAIC,
        /** Raised when deciding or solving the equation. */
        SEMANTIC
    }

    private final Category category;

    ErrorKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
