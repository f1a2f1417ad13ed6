package org.pragmatica.bet.tree;

import java.util.Optional;

/**
 * Internal node of an expression tree.
 *
 * <p>A node without operator is a pass-through (parenthesis grouping or the initial root).
 * A unary node only uses its {@code left} slot. Parent links are lookup-only ids.
 *
 * @param operator the operator, empty for a pass-through node
 * @param parent   id of the parent node, empty at the root
 * @param left     first child slot
 * @param right    second child slot
 * @param unary    whether the operator sits in unary position
 */
public record Node<O>(
 Optional<O> operator,
 Optional<Integer> parent,
 Child left,
 Child right,
 boolean unary) {
    public static <O> Node<O> empty() {
        return new Node<>(Optional.empty(), Optional.empty(), Child.empty(), Child.empty(), false);
    }

    public static <O> Node<O> unary(O operator, int parent) {
        return new Node<>(Optional.of(operator), Optional.of(parent), Child.empty(), Child.empty(), true);
    }

    public static <O> Node<O> binary(O operator, Optional<Integer> parent, Child left) {
        return new Node<>(Optional.of(operator), parent, left, Child.empty(), false);
    }

    /**
     * A node is full when it can't take another child.
     */
    public boolean isFull() {
        return unary
               ? left.isPresent()
               : right.isPresent();
    }

    public boolean hasOperator() {
        return operator.isPresent();
    }

    public boolean isRoot() {
        return parent.isEmpty();
    }

    /**
     * Copy with the child placed into the first free slot.
     */
    public Node<O> withChild(Child child) {
        return left.isEmpty()
               ? withLeft(child)
               : withRight(child);
    }

    public Node<O> withLeft(Child child) {
        return new Node<>(operator, parent, child, right, unary);
    }

    public Node<O> withRight(Child child) {
        return new Node<>(operator, parent, left, child, unary);
    }

    public Node<O> withParent(Optional<Integer> newParent) {
        return new Node<>(operator, newParent, left, right, unary);
    }

    public Node<O> withOperator(O newOperator) {
        return new Node<>(Optional.of(newOperator), parent, left, right, unary);
    }
}
