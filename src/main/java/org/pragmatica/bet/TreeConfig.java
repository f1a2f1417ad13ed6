package org.pragmatica.bet;

import org.pragmatica.bet.error.SyntaxPolicy;

/**
 * Tree construction options.
 *
 * @param syntaxPolicy    whether pushes are checked against the {@code accept*} predicates
 * @param initialCapacity initial size of the atom and node arenas
 */
public record TreeConfig(
 SyntaxPolicy syntaxPolicy,
 int initialCapacity) {
    public static final TreeConfig DEFAULT = new TreeConfig(
    SyntaxPolicy.LENIENT,
    10);

    public TreeConfig {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("initialCapacity must be positive, got " + initialCapacity);
        }
    }

    public boolean strict() {
        return syntaxPolicy == SyntaxPolicy.STRICT;
    }
}
