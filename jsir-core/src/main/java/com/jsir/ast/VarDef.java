package com.jsir.ast;

import java.util.Objects;

public record VarDef(
    Position pos,
    Ident name,
    Tree rhs  // EmptyTree when there is no initializer
) implements Tree {
    public VarDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rhs, "rhs");
    }
}
