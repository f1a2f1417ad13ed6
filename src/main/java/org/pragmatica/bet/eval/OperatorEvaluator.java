package org.pragmatica.bet.eval;

import java.util.Optional;

/**
 * Applies an operator to its operand values.
 */
@FunctionalInterface
public interface OperatorEvaluator<O, R> {
    /**
     * @param operator the node operator
     * @param left     value of the left operand
     * @param right    value of the right operand, empty for unary operators
     */
    R apply(O operator, R left, Optional<R> right);
}
