package com.jsir.ast;

import java.util.Objects;

public record UnaryOp(
    Position pos,
    String op,
    Tree lhs
) implements Tree {
    public UnaryOp {
        Objects.requireNonNull(lhs, "lhs");
    }
}
