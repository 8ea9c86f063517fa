package com.jsir.ast;

import java.util.List;
import java.util.Objects;

public record MethodDef(
    Position pos,
    PropertyName name,
    List<Ident> params,
    Tree body
) implements Tree {
    public MethodDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        params = List.copyOf(params);
    }
}
