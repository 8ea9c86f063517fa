package com.jsir.ast;

import java.util.List;
import java.util.Objects;

/**
 * Anonymous function expression.
 */
public record Function(
    Position pos,
    List<Ident> params,
    Tree body
) implements Tree {
    public Function {
        Objects.requireNonNull(body, "body");
        params = List.copyOf(params);
    }
}
