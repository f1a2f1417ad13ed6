package org.pragmatica.bet.eval;

import java.util.Optional;

/**
 * {@link OperatorEvaluator} which may fail. The first failure aborts the whole evaluation.
 */
@FunctionalInterface
public interface FallibleOperatorEvaluator<O, R, E extends Exception> {
    R apply(O operator, R left, Optional<R> right) throws E;
}
