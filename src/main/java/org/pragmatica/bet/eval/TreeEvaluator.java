package org.pragmatica.bet.eval;

import org.pragmatica.bet.tree.Child;
import org.pragmatica.bet.tree.Node;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Post-order evaluation of the arenas of a tree.
 *
 * <p>Walks an explicit frame stack instead of the call stack, so deeply nested
 * expressions don't overflow the thread stack. The arenas are only read.
 */
public final class TreeEvaluator<O, A> {
    private final List<Node<O>> nodes;
    private final List<A> atoms;

    private TreeEvaluator(List<Node<O>> nodes, List<A> atoms) {
        this.nodes = nodes;
        this.atoms = atoms;
    }

    public static <O, A> TreeEvaluator<O, A> over(List<Node<O>> nodes, List<A> atoms) {
        return new TreeEvaluator<>(nodes, atoms);
    }

    /**
     * Evaluate the subtree rooted at {@code start}.
     *
     * <p>A pass-through node yields its left value. An operator node whose left value is
     * absent yields no value. When {@code shortCircuit} accepts the left value, the node
     * yields it and the right subtree is never visited. A {@code null} returned by a
     * callback counts as no value.
     *
     * @return the value of the subtree, empty when there is nothing to evaluate
     * @throws E the first failure of {@code evalAtom} or {@code evalOp}, unchanged
     */
    public <R, E extends Exception> Optional<R> evaluate(int start,
                                                         FallibleFunction<A, R, E> evalAtom,
                                                         FallibleOperatorEvaluator<O, R, E> evalOp,
                                                         BiPredicate<? super O, ? super R> shortCircuit) throws E {
        var frames = new ArrayDeque<Frame<R>>();
        frames.push(new Frame<>(start));
        Optional<R> returned = Optional.empty();

        while (!frames.isEmpty()) {
            var frame = frames.peek();
            var node = nodes.get(frame.nodeId);

            switch (frame.stage) {
                case LEFT -> {
                    frame.stage = Stage.AFTER_LEFT;
                    if (node.left() instanceof Child.NodeRef ref) {
                        frames.push(new Frame<>(ref.id()));
                    } else {
                        returned = leaf(node.left(), evalAtom);
                    }
                }
                case AFTER_LEFT -> {
                    if (node.operator().isEmpty() || returned.isEmpty()) {
                        // pass-through, or operator without operand: the left value stands
                        frames.pop();
                    } else if (shortCircuit.test(node.operator().get(), returned.get())) {
                        frames.pop();
                    } else {
                        frame.left = returned.get();
                        frame.stage = Stage.AFTER_RIGHT;
                        if (node.right() instanceof Child.NodeRef ref) {
                            frames.push(new Frame<>(ref.id()));
                        } else {
                            returned = leaf(node.right(), evalAtom);
                        }
                    }
                }
                case AFTER_RIGHT -> {
                    frames.pop();
                    returned = Optional.ofNullable(evalOp.apply(node.operator().get(), frame.left, returned));
                }
            }
        }
        return returned;
    }

    private <R, E extends Exception> Optional<R> leaf(Child child, FallibleFunction<A, R, E> evalAtom) throws E {
        if (child instanceof Child.AtomRef ref) {
            return Optional.ofNullable(evalAtom.apply(atoms.get(ref.id())));
        }
        return Optional.empty();
    }

    private enum Stage {
        LEFT,
        AFTER_LEFT,
        AFTER_RIGHT
    }

    private static final class Frame<R> {
        private final int nodeId;
        private Stage stage = Stage.LEFT;
        private R left;

        private Frame(int nodeId) {
            this.nodeId = nodeId;
        }
    }
}
