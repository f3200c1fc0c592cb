package com.exprsolve.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Stack machine reducing a postfix sequence to a single polynomial.
 */
public class PostfixEvaluator {

    public Polynomial evaluate(List<PostfixNode> nodes) {
        Deque<Polynomial> stack = new ArrayDeque<>();

        for (PostfixNode node : nodes) {
            switch (node.getKind()) {
                case VALUE:
                    stack.push(node.getValue());
                    break;
                case OPERATION:
                    Operation op = node.getOperation();
                    List<Polynomial> operands = new ArrayList<>(op.getArity());
                    for (int i = 0; i < op.getArity(); i++) {
                        if (stack.isEmpty()) {
                            throw new ExpressionException(ErrorKind.INSUFFICIENT_OPERANDS,
                                    "Insufficient number of operands for " + op.getIdentifier());
                        }
                        operands.add(stack.pop());
                    }
                    // popped right to left
                    Collections.reverse(operands);
                    stack.push(op.apply(operands));
                    break;
            }
        }

        if (stack.isEmpty()) {
            throw new ExpressionException(ErrorKind.INSUFFICIENT_OPERANDS, "Insufficient values left");
        }
        Polynomial result = stack.pop();
        if (!stack.isEmpty()) {
            throw new ExpressionException(ErrorKind.EXCESS_OPERANDS, "Too many values left");
        }
        return result;
    }
}
