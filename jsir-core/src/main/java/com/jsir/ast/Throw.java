package com.jsir.ast;

import java.util.Objects;

public record Throw(
    Position pos,
    Tree expr
) implements Tree {
    public Throw {
        Objects.requireNonNull(expr, "expr");
    }
}
