package com.jsir.ast;

/**
 * Placeholder for an absent child, e.g. a missing {@code else} branch or a class without parent.
 */
public record EmptyTree() implements Tree {
    public static final EmptyTree INSTANCE = new EmptyTree();

    @Override
    public Position pos() {
        return Position.NO_POSITION;
    }
}
