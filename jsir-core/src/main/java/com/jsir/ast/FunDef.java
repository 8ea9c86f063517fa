package com.jsir.ast;

import java.util.List;
import java.util.Objects;

public record FunDef(
    Position pos,
    Ident name,
    List<Ident> params,
    Tree body
) implements Tree {
    public FunDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        params = List.copyOf(params);
    }
}
