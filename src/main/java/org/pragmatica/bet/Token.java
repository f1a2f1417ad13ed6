package org.pragmatica.bet;

/**
 * A token fed to {@link BeTree#push(Token)}. Producing tokens from text is up to the caller.
 */
public sealed interface Token<O, A> {

    static <O, A> Token<O, A> atom(A value) {
        return new Atom<>(value);
    }

    static <O, A> Token<O, A> operator(O operator) {
        return new Operator<>(operator);
    }

    static <O, A> Token<O, A> openPar() {
        return new OpeningParenthesis<>();
    }

    static <O, A> Token<O, A> closePar() {
        return new ClosingParenthesis<>();
    }

    record Atom<O, A>(A value) implements Token<O, A> {}

    /**
     * Operator token. Unary or binary is decided by the tree from the previous token.
     */
    record Operator<O, A>(O operator) implements Token<O, A> {}

    record OpeningParenthesis<O, A>() implements Token<O, A> {}

    record ClosingParenthesis<O, A>() implements Token<O, A> {}
}
