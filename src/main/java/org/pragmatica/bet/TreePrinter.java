package org.pragmatica.bet;

import org.pragmatica.bet.tree.Child;
import org.pragmatica.bet.tree.Node;

import java.util.function.Function;

/**
 * Debug rendering of expression trees.
 */
public final class TreePrinter {
    private static final String INDENT = "  ";

    private TreePrinter() {}

    /**
     * One line per node and atom, indented by depth, starting at the head.
     *
     * <pre>
     * #0 AND
     *   #1 OR
     *     A
     *     B
     *   #3 NOT (unary)
     *     C
     * </pre>
     */
    public static <O, A> String dump(BeTree<O, A> tree) {
        var sb = new StringBuilder();
        dumpNode(tree, tree.headId(), 0, sb);
        return sb.toString();
    }

    private static <O, A> void dumpNode(BeTree<O, A> tree, int nodeId, int depth, StringBuilder sb) {
        var node = tree.nodes()
                       .get(nodeId);
        sb.append(INDENT.repeat(depth))
          .append('#')
          .append(nodeId)
          .append(' ')
          .append(node.operator()
                      .map(String::valueOf)
                      .orElse("()"));
        if (node.unary()) {
            sb.append(" (unary)");
        }
        sb.append('\n');
        dumpChild(tree, node.left(), depth + 1, sb);
        dumpChild(tree, node.right(), depth + 1, sb);
    }

    private static <O, A> void dumpChild(BeTree<O, A> tree, Child child, int depth, StringBuilder sb) {
        if (child instanceof Child.NodeRef ref) {
            dumpNode(tree, ref.id(), depth, sb);
        } else if (child instanceof Child.AtomRef ref) {
            sb.append(INDENT.repeat(depth))
              .append(tree.atom(ref.id())
                          .map(String::valueOf)
                          .orElse("?"))
              .append('\n');
        }
    }

    /**
     * Fully parenthesized infix form, making the grouping explicit:
     * {@code A & B | C} renders as {@code ((A & B) | C)}, {@code !A} as {@code !A}.
     * A missing operand renders as {@code ?}.
     */
    public static <O, A> String infix(BeTree<O, A> tree,
                                      Function<? super O, String> operatorText,
                                      Function<? super A, String> atomText) {
        return infixNode(tree, tree.head(), operatorText, atomText);
    }

    private static <O, A> String infixNode(BeTree<O, A> tree,
                                           Node<O> node,
                                           Function<? super O, String> operatorText,
                                           Function<? super A, String> atomText) {
        var left = infixChild(tree, node.left(), operatorText, atomText);
        if (node.operator()
                .isEmpty()) {
            return left;
        }
        var op = operatorText.apply(node.operator()
                                        .get());
        if (node.unary()) {
            return op + left;
        }
        return "(" + left + " " + op + " " + infixChild(tree, node.right(), operatorText, atomText) + ")";
    }

    private static <O, A> String infixChild(BeTree<O, A> tree,
                                            Child child,
                                            Function<? super O, String> operatorText,
                                            Function<? super A, String> atomText) {
        if (child instanceof Child.NodeRef ref) {
            return infixNode(tree, tree.nodes()
                                       .get(ref.id()), operatorText, atomText);
        }
        if (child instanceof Child.AtomRef ref) {
            return tree.atom(ref.id())
                       .map(atomText)
                       .orElse("?");
        }
        return "?";
    }
}
