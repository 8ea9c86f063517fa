package com.jsir.ast;

import java.util.List;
import java.util.Objects;

/**
 * A sequence of statements followed by a trailing tree.
 *
 * <p>In expression position the block evaluates to {@code expr}; in statement position
 * {@code expr} is just the last statement.</p>
 */
public record Block(
    Position pos,
    List<Tree> stats,
    Tree expr
) implements Tree {
    public Block {
        Objects.requireNonNull(expr, "expr");
        stats = List.copyOf(stats);
    }
}
