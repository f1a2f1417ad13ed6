package org.pragmatica.bet.tree;

/**
 * One of the two child slots of a {@link Node}.
 * Children are the only links between nodes, and between nodes and atoms.
 */
public sealed interface Child {
    /**
     * Shared instance of the empty slot.
     */
    Child EMPTY = new Empty();

    default boolean isPresent() {
        return !(this instanceof Empty);
    }

    default boolean isEmpty() {
        return !isPresent();
    }

    static Child empty() {
        return EMPTY;
    }

    static Child node(int id) {
        return new NodeRef(id);
    }

    static Child atom(int id) {
        return new AtomRef(id);
    }

    /**
     * Unoccupied slot.
     */
    record Empty() implements Child {}

    /**
     * Reference to a node of the node arena.
     */
    record NodeRef(int id) implements Child {}

    /**
     * Reference to an atom of the atom arena.
     */
    record AtomRef(int id) implements Child {}
}
