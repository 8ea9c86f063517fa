package com.jsir.ast;

import java.util.Objects;

public record Assign(
    Position pos,
    Tree lhs,
    Tree rhs
) implements Tree {
    public Assign {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
    }
}
