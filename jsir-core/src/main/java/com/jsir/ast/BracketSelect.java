package com.jsir.ast;

import java.util.Objects;

/**
 * {@code qualifier[item]}. When {@code item} is a {@link StringLiteral} this is a named access,
 * otherwise a computed one.
 */
public record BracketSelect(
    Position pos,
    Tree qualifier,
    Tree item
) implements Tree {
    public BracketSelect {
        Objects.requireNonNull(qualifier, "qualifier");
        Objects.requireNonNull(item, "item");
    }
}
