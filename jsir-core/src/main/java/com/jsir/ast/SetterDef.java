package com.jsir.ast;

import java.util.Objects;

public record SetterDef(
    Position pos,
    PropertyName name,
    Ident param,
    Tree body
) implements Tree {
    public SetterDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(param, "param");
        Objects.requireNonNull(body, "body");
    }
}
