package com.jsir.ast;

import java.util.Objects;

public record BinaryOp(
    Position pos,
    String op,
    Tree lhs,
    Tree rhs
) implements Tree {
    public BinaryOp {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
    }
}
