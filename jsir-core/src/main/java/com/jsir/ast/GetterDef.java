package com.jsir.ast;

import java.util.Objects;

public record GetterDef(
    Position pos,
    PropertyName name,
    Tree body
) implements Tree {
    public GetterDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
    }
}
