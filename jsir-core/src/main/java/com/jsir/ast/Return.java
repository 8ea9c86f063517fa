package com.jsir.ast;

import java.util.Objects;

public record Return(
    Position pos,
    Tree expr  // EmptyTree for a bare return
) implements Tree {
    public Return {
        Objects.requireNonNull(expr, "expr");
    }
}
