package com.jsir.ast;

import java.util.List;
import java.util.Objects;

public record Apply(
    Position pos,
    Tree fun,
    List<Tree> args
) implements Tree {
    public Apply {
        Objects.requireNonNull(fun, "fun");
        args = List.copyOf(args);
    }
}
