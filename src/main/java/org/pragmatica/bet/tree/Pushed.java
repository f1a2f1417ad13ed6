package org.pragmatica.bet.tree;

/**
 * Kind of the last token pushed into a tree. Drives operator arity and the {@code accept*} predicates.
 */
public enum Pushed {
    NOTHING,
    ATOM,
    OPERATOR,
    OPENING_PARENTHESIS,
    CLOSING_PARENTHESIS;

    /**
     * Position in which an operand may start: an atom, a unary operator or an opening parenthesis.
     */
    public boolean opensOperand() {
        return this == NOTHING || this == OPERATOR || this == OPENING_PARENTHESIS;
    }

    /**
     * Position right after a complete operand: a binary operator or a closing parenthesis may follow.
     */
    public boolean closesOperand() {
        return this == ATOM || this == CLOSING_PARENTHESIS;
    }
}
