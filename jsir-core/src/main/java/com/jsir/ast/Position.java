package com.jsir.ast;

/**
 * Source position attached to every tree node.
 *
 * <p>Positions are opaque to the tree layer: they are only propagated, never inspected.
 * {@link #NO_POSITION} marks nodes that have no origin in source text.</p>
 */
public record Position(
    String source,  // Can be null
    int line,
    int column
) {
    public static final Position NO_POSITION = new Position(null, 0, 0);

    public Position(int line, int column) {
        this(null, line, column);
    }

    public boolean isDefined() {
        return !equals(NO_POSITION);
    }

    @Override
    public String toString() {
        if (!isDefined()) {
            return "NoPosition";
        }
        return (source != null ? source + ":" : "") + line + ":" + column;
    }
}
