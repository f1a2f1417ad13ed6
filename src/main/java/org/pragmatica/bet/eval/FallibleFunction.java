package org.pragmatica.bet.eval;

/**
 * Function which may fail with a checked exception of the caller's choice.
 */
@FunctionalInterface
public interface FallibleFunction<T, R, E extends Exception> {
    R apply(T value) throws E;
}
