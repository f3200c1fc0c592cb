package com.exprsolve.expr;

/**
 * One entry of a postfix sequence: either a value or an operation.
 */
public final class PostfixNode {

    public enum Kind { VALUE, OPERATION }

    private final Kind kind;
    private final Polynomial value;
    private final Operation operation;

    private PostfixNode(Kind kind, Polynomial value, Operation operation) {
        this.kind = kind;
        this.value = value;
        this.operation = operation;
    }

    public static PostfixNode value(Polynomial value) {
        return new PostfixNode(Kind.VALUE, value, null);
    }

    public static PostfixNode operation(Operation operation) {
        return new PostfixNode(Kind.OPERATION, null, operation);
    }

    public Kind getKind() {
        return kind;
    }

    public Polynomial getValue() {
        return value;
    }

    public Operation getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return kind == Kind.VALUE ? value.toString() : operation.getIdentifier();
    }
}
