package com.jsir.ast;

import java.util.Objects;

/**
 * {@code qualifier.item}. Prefer {@link Select#of} over building this directly.
 */
public record DotSelect(
    Position pos,
    Tree qualifier,
    Ident item
) implements Tree {
    public DotSelect {
        Objects.requireNonNull(qualifier, "qualifier");
        Objects.requireNonNull(item, "item");
    }
}
