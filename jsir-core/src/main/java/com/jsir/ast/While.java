package com.jsir.ast;

import java.util.Objects;

public record While(
    Position pos,
    Tree cond,
    Tree body
) implements Tree {
    public While {
        Objects.requireNonNull(cond, "cond");
        Objects.requireNonNull(body, "body");
    }
}
