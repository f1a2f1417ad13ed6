package org.pragmatica.bet;

import org.pragmatica.bet.error.SyntaxError;
import org.pragmatica.bet.error.SyntaxException;
import org.pragmatica.bet.error.SyntaxPolicy;
import org.pragmatica.bet.eval.FallibleFunction;
import org.pragmatica.bet.eval.FallibleOperatorEvaluator;
import org.pragmatica.bet.eval.OperatorEvaluator;
import org.pragmatica.bet.eval.TreeEvaluator;
import org.pragmatica.bet.tree.Child;
import org.pragmatica.bet.tree.Node;
import org.pragmatica.bet.tree.Pushed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Binary expression tree, built by pushing tokens left to right and evaluated with caller semantics.
 *
 * <p>Operators have no precedence: a binary operator takes everything built so far at the current
 * parenthesis level as its left operand, so {@code A & B | C & D} reads as {@code ((A & B) | C) & D}.
 * An operator pushed where an operand is expected is unary.
 *
 * <p>Example usage:
 * <pre>{@code
 * BeTree<BoolOperator, Character> expr = BeTree.create();
 * expr.openPar();
 * expr.pushAtom('A');
 * expr.pushOperator(BoolOperator.OR);
 * expr.pushAtom('B');
 * expr.closePar();
 * expr.pushOperator(BoolOperator.AND);
 * expr.pushOperator(BoolOperator.NOT);
 * expr.pushAtom('C');
 *
 * Optional<Boolean> value = expr.eval(
 *     c -> trues.contains(c),
 *     (op, left, right) -> op.apply(left, right),
 *     (op, left) -> op.shortCircuits(left));
 * }</pre>
 *
 * <p>Nodes and atoms live in two append-only arenas and are referenced by index; ids stay valid
 * for the lifetime of the tree. A tree is not thread safe: building needs exclusive access,
 * evaluation only reads and may run concurrently once building is over.
 *
 * @param <O> operator type, compared with {@code equals}
 * @param <A> atom type
 */
public final class BeTree<O, A> {
    private static final Logger log = LoggerFactory.getLogger(BeTree.class);

    private final TreeConfig config;
    private final Optional<Predicate<? super O>> unaryHint;
    private final List<A> atoms;
    private final List<Node<O>> nodes;
    private int head;
    private int tail;
    private Pushed lastPushed;
    private int openness;
    private int operatorCount;
    private int position;

    private BeTree(TreeConfig config,
                   Optional<Predicate<? super O>> unaryHint,
                   List<A> atoms,
                   List<Node<O>> nodes,
                   int head,
                   int tail,
                   Pushed lastPushed,
                   int openness,
                   int operatorCount,
                   int position) {
        this.config = config;
        this.unaryHint = unaryHint;
        this.atoms = atoms;
        this.nodes = nodes;
        this.head = head;
        this.tail = tail;
        this.lastPushed = lastPushed;
        this.openness = openness;
        this.operatorCount = operatorCount;
        this.position = position;
    }

    /**
     * Create an empty lenient tree.
     */
    public static <O, A> BeTree<O, A> create() {
        return create(TreeConfig.DEFAULT);
    }

    /**
     * Create an empty tree with custom configuration.
     */
    public static <O, A> BeTree<O, A> create(TreeConfig config) {
        return create(config, Optional.empty());
    }

    /**
     * Create a builder for more complex tree configuration.
     */
    public static <O, A> Builder<O, A> builder() {
        return new Builder<>();
    }

    private static <O, A> BeTree<O, A> create(TreeConfig config, Optional<Predicate<? super O>> unaryHint) {
        var nodes = new ArrayList<Node<O>>(config.initialCapacity());
        nodes.add(Node.empty());
        return new BeTree<>(config,
                            unaryHint,
                            new ArrayList<>(config.initialCapacity()),
                            nodes,
                            0,
                            0,
                            Pushed.NOTHING,
                            0,
                            0,
                            0);
    }

    // === Building ===

    /**
     * Add an atom into the first free slot of the current node.
     */
    public void pushAtom(A atom) {
        if (config.strict() && !acceptAtom()) {
            reject(new SyntaxError.UnexpectedAtom(position));
        }
        var atomId = storeAtom(atom);
        addChild(Child.atom(atomId));
        leaveCompleteUnaryNodes();
        lastPushed = Pushed.ATOM;
        position++;
    }

    /**
     * Return the last atom if the last pushed token is an atom, otherwise push a new atom
     * made by {@code factory} and return it.
     *
     * <p>Lets a caller accumulate a multi-character atom, e.g. into a {@code StringBuilder},
     * without knowing in advance where atoms end.
     */
    public A mutateOrCreateAtom(Supplier<? extends A> factory) {
        if (lastPushed != Pushed.ATOM) {
            pushAtom(factory.get());
        }
        return atoms.get(atoms.size() - 1);
    }

    /**
     * Same as {@link #mutateOrCreateAtom(Supplier)} for immutable atoms: the current
     * (possibly fresh) atom is replaced with the result of {@code update}.
     */
    public void updateOrCreateAtom(Supplier<? extends A> factory, UnaryOperator<A> update) {
        var current = mutateOrCreateAtom(factory);
        atoms.set(atoms.size() - 1, update.apply(current));
    }

    /**
     * Open a parenthesis: a new empty node becomes a child of the current node and receives
     * the following tokens.
     */
    public void openPar() {
        if (config.strict() && !acceptOpeningPar()) {
            reject(new SyntaxError.UnexpectedOpeningParenthesis(position));
        }
        var nodeId = storeNode(Node.<O>empty()
                                   .withParent(Optional.of(tail)));
        addChild(Child.node(nodeId));
        tail = nodeId;
        openness++;
        lastPushed = Pushed.OPENING_PARENTHESIS;
        position++;
    }

    /**
     * Close a parenthesis. Without an open parenthesis the call is absorbed, unless the tree is strict.
     */
    public void closePar() {
        if (config.strict() && !acceptClosingPar()) {
            reject(new SyntaxError.UnmatchedClosingParenthesis(position));
        }
        var parent = nodes.get(tail)
                          .parent();
        if (openness > 0 && parent.isPresent()) {
            tail = parent.get();
            openness--;
            leaveCompleteUnaryNodes();
        } else {
            log.debug("Ignoring unmatched closing parenthesis at token {}", position);
        }
        lastPushed = Pushed.CLOSING_PARENTHESIS;
        position++;
    }

    /**
     * Add an operator. It is binary after an atom or a closing parenthesis, unary otherwise.
     */
    public void pushOperator(O operator) {
        var binary = lastPushed.closesOperand();
        if (config.strict()) {
            checkArity(operator, binary);
        }
        if (binary) {
            pushBinaryOperator(operator);
        } else {
            pushUnaryOperator(operator);
        }
        operatorCount++;
        lastPushed = Pushed.OPERATOR;
        position++;
    }

    /**
     * Dispatch a token to the matching push operation.
     */
    public void push(Token<O, A> token) {
        if (token instanceof Token.Atom<O, A> atom) {
            pushAtom(atom.value());
        } else if (token instanceof Token.Operator<O, A> operator) {
            pushOperator(operator.operator());
        } else if (token instanceof Token.OpeningParenthesis<?, ?>) {
            openPar();
        } else {
            closePar();
        }
    }

    private void pushUnaryOperator(O operator) {
        var nodeId = storeNode(Node.unary(operator, tail));
        addChild(Child.node(nodeId));
        tail = nodeId;
    }

    private void pushBinaryOperator(O operator) {
        var current = nodes.get(tail);
        if (!current.isFull()) {
            // the current node has a single operand, it just gets the operator
            nodes.set(tail, current.withOperator(operator));
            return;
        }
        // the whole current subtree becomes the left operand of the new node
        var newId = storeNode(Node.binary(operator, current.parent(), Child.node(tail)));
        if (current.parent()
                   .isPresent()) {
            retarget(current.parent()
                            .get(), tail, newId);
        } else {
            head = newId;
        }
        nodes.set(tail, current.withParent(Optional.of(newId)));
        log.trace("Rotated node {} under new binary node {}", tail, newId);
        tail = newId;
    }

    // a complete unary operand hands the cursor back to the node holding it,
    // so the next binary operator takes the whole level as left operand
    private void leaveCompleteUnaryNodes() {
        var node = nodes.get(tail);
        while (node.unary() && node.isFull() && node.parent()
                                                    .isPresent()) {
            tail = node.parent()
                       .get();
            node = nodes.get(tail);
        }
    }

    private void retarget(int parentId, int oldChild, int newChild) {
        var parent = nodes.get(parentId);
        if (parent.left()
                  .equals(Child.node(oldChild))) {
            nodes.set(parentId, parent.withLeft(Child.node(newChild)));
        } else {
            assert parent.right()
                         .equals(Child.node(oldChild)) : "node " + oldChild + " is not a child of " + parentId;
            nodes.set(parentId, parent.withRight(Child.node(newChild)));
        }
    }

    // a full tail only happens with unchecked input, the right child is then replaced
    private void addChild(Child child) {
        nodes.set(tail, nodes.get(tail)
                             .withChild(child));
    }

    private int storeAtom(A atom) {
        atoms.add(atom);
        return atoms.size() - 1;
    }

    private int storeNode(Node<O> node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    private void checkArity(O operator, boolean binary) {
        if (unaryHint.isEmpty()) {
            return;
        }
        var unary = unaryHint.get()
                             .test(operator);
        if (binary == unary) {
            reject(new SyntaxError.UnexpectedOperator(position, String.valueOf(operator)));
        }
    }

    private void reject(SyntaxError error) {
        log.debug("Rejecting token: {}", error.message());
        throw new SyntaxException(error);
    }

    // === Grammar checks ===

    public boolean acceptAtom() {
        return lastPushed.opensOperand();
    }

    public boolean acceptUnaryOperator() {
        return lastPushed.opensOperand();
    }

    public boolean acceptOpeningPar() {
        return lastPushed.opensOperand();
    }

    public boolean acceptBinaryOperator() {
        return lastPushed.closesOperand();
    }

    public boolean acceptClosingPar() {
        return lastPushed.closesOperand() && openness > 0;
    }

    /**
     * Check the expression is finished: not empty, no dangling operator, all parentheses closed.
     *
     * @return this tree
     * @throws SyntaxException describing the first problem found
     */
    public BeTree<O, A> validate() {
        if (isEmpty()) {
            throw new SyntaxException(new SyntaxError.EmptyExpression(position));
        }
        if (!lastPushed.closesOperand()) {
            throw new SyntaxException(new SyntaxError.DanglingOperator(position));
        }
        if (openness > 0) {
            throw new SyntaxException(new SyntaxError.UnclosedParenthesis(position, openness));
        }
        return this;
    }

    // === Queries ===

    public boolean isEmpty() {
        return atoms.isEmpty();
    }

    /**
     * Whether the expression is a single atom, with no operator.
     */
    public boolean isAtomic() {
        return atoms.size() == 1 && operatorCount == 0;
    }

    /**
     * Number of parentheses currently open.
     */
    public int openness() {
        return openness;
    }

    /**
     * The last atom, when the last pushed token is an atom.
     */
    public Optional<A> currentAtom() {
        return lastPushed == Pushed.ATOM
               ? Optional.of(atoms.get(atoms.size() - 1))
               : Optional.empty();
    }

    /**
     * Atoms in push order. Each call returns a fresh stream.
     */
    public Stream<A> atomStream() {
        return atoms.stream();
    }

    /**
     * Copy of the atoms in push order.
     */
    public List<A> atoms() {
        return new ArrayList<>(atoms);
    }

    public Optional<A> atom(int id) {
        return id >= 0 && id < atoms.size()
               ? Optional.of(atoms.get(id))
               : Optional.empty();
    }

    public Optional<Node<O>> node(int id) {
        return id >= 0 && id < nodes.size()
               ? Optional.of(nodes.get(id))
               : Optional.empty();
    }

    /**
     * The node evaluation starts from.
     */
    public Node<O> head() {
        return nodes.get(head);
    }

    public int headId() {
        return head;
    }

    /**
     * Id of the node receiving the next child or operator.
     */
    public int tailId() {
        return tail;
    }

    public Pushed lastPushed() {
        return lastPushed;
    }

    public int atomCount() {
        return atoms.size();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int operatorCount() {
        return operatorCount;
    }

    public TreeConfig config() {
        return config;
    }

    // === Evaluation ===

    /**
     * Evaluate the expression.
     *
     * @param evalAtom     gives a value to an atom
     * @param evalOp       applies an operator to one or two values
     * @param shortCircuit tells whether the left value is enough, in which case the right operand is skipped
     * @return the value, empty when the tree has nothing to evaluate
     */
    public <R> Optional<R> eval(Function<? super A, ? extends R> evalAtom,
                                OperatorEvaluator<? super O, R> evalOp,
                                BiPredicate<? super O, ? super R> shortCircuit) {
        return TreeEvaluator.over(nodes, atoms)
                            .<R, RuntimeException>evaluate(head, evalAtom::apply, evalOp::apply, shortCircuit);
    }

    /**
     * Evaluate the expression with callbacks which may fail. The first failure stops the
     * evaluation and is thrown as is.
     */
    public <R, E extends Exception> Optional<R> evalFallible(FallibleFunction<? super A, ? extends R, E> evalAtom,
                                                             FallibleOperatorEvaluator<? super O, R, E> evalOp,
                                                             BiPredicate<? super O, ? super R> shortCircuit) throws E {
        return TreeEvaluator.over(nodes, atoms)
                            .<R, E>evaluate(head, evalAtom::apply, evalOp::apply, shortCircuit);
    }

    // === Transformations ===

    /**
     * Build a tree with the same structure whose atoms are the results of {@code mapper}.
     * Typical use is to build with raw strings, then parse each atom once the structure is known.
     *
     * @throws E the first failure of {@code mapper}; no tree is produced
     */
    public <B, E extends Exception> BeTree<O, B> tryMapAtoms(FallibleFunction<? super A, ? extends B, E> mapper) throws E {
        var mapped = new ArrayList<B>(Math.max(atoms.size(), config.initialCapacity()));
        for (var atom : atoms) {
            mapped.add(mapper.apply(atom));
        }
        return new BeTree<>(config,
                            unaryHint,
                            mapped,
                            new ArrayList<>(nodes),
                            head,
                            tail,
                            lastPushed,
                            openness,
                            operatorCount,
                            position);
    }

    public <B> BeTree<O, B> mapAtoms(Function<? super A, ? extends B> mapper) {
        return this.<B, RuntimeException>tryMapAtoms(mapper::apply);
    }

    /**
     * Drop the operator-less wrapper nodes at the root, e.g. those left by {@code (((A)))}.
     * Evaluation results are unchanged.
     */
    public void simplify() {
        var current = nodes.get(head);
        while (isWrapper(current) && current.left() instanceof Child.NodeRef ref) {
            var dropped = head;
            head = ref.id();
            current = nodes.get(head)
                           .withParent(Optional.empty());
            nodes.set(head, current);
            if (tail == dropped) {
                tail = head;
            }
        }
    }

    private static boolean isWrapper(Node<?> node) {
        return !node.hasOperator() && !node.unary() && node.right()
                                                           .isEmpty();
    }

    /**
     * Read-only view of the node arena.
     */
    List<Node<O>> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BeTree<?, ?> other)) {
            return false;
        }
        return head == other.head
               && tail == other.tail
               && openness == other.openness
               && operatorCount == other.operatorCount
               && lastPushed == other.lastPushed
               && atoms.equals(other.atoms)
               && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(atoms, nodes, head, tail, lastPushed, openness, operatorCount);
    }

    @Override
    public String toString() {
        return TreePrinter.dump(this);
    }

    /**
     * Builder for trees with non-default configuration.
     */
    public static final class Builder<O, A> {
        private SyntaxPolicy syntaxPolicy = TreeConfig.DEFAULT.syntaxPolicy();
        private int initialCapacity = TreeConfig.DEFAULT.initialCapacity();
        private Optional<Predicate<? super O>> unaryHint = Optional.empty();

        private Builder() {}

        public Builder<O, A> syntaxPolicy(SyntaxPolicy policy) {
            this.syntaxPolicy = policy;
            return this;
        }

        public Builder<O, A> strict() {
            return syntaxPolicy(SyntaxPolicy.STRICT);
        }

        public Builder<O, A> initialCapacity(int capacity) {
            this.initialCapacity = capacity;
            return this;
        }

        /**
         * Tell which operators are unary. Only used by strict trees, to reject a unary
         * operator in binary position and the other way round.
         */
        public Builder<O, A> unaryOperators(Predicate<? super O> isUnary) {
            this.unaryHint = Optional.of(isUnary);
            return this;
        }

        public BeTree<O, A> build() {
            return create(new TreeConfig(syntaxPolicy, initialCapacity), unaryHint);
        }
    }
}
