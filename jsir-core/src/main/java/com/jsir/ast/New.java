package com.jsir.ast;

import java.util.List;
import java.util.Objects;

public record New(
    Position pos,
    Tree ctor,
    List<Tree> args
) implements Tree {
    public New {
        Objects.requireNonNull(ctor, "ctor");
        args = List.copyOf(args);
    }
}
