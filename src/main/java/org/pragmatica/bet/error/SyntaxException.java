package org.pragmatica.bet.error;

/**
 * Thrown when a strict tree rejects a token, or when {@code validate()} finds the expression incomplete.
 */
public final class SyntaxException extends RuntimeException {
    private final SyntaxError error;

    public SyntaxException(SyntaxError error) {
        super(error.message());
        this.error = error;
    }

    public SyntaxError error() {
        return error;
    }
}
