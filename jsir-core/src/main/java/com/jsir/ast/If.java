package com.jsir.ast;

import java.util.Objects;

public record If(
    Position pos,
    Tree cond,
    Tree thenp,
    Tree elsep  // EmptyTree when there is no else branch
) implements Tree {
    public If {
        Objects.requireNonNull(cond, "cond");
        Objects.requireNonNull(thenp, "thenp");
        Objects.requireNonNull(elsep, "elsep");
    }
}
