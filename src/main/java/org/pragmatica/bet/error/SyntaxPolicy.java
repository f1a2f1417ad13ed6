package org.pragmatica.bet.error;

/**
 * How a tree reacts to tokens pushed in a grammatically invalid order.
 */
public enum SyntaxPolicy {
    /**
     * Accept everything. Excess closing parentheses are absorbed, odd sequences
     * produce trees which may evaluate to no value.
     */
    LENIENT,

    /**
     * Reject a token the {@code accept*} predicates refuse, leaving the tree untouched.
     */
    STRICT
}
