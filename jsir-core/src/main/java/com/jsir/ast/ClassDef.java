package com.jsir.ast;

import java.util.List;
import java.util.Objects;

/**
 * ECMAScript 6 class. {@code defs} holds {@link MethodDef}, {@link GetterDef} and {@link SetterDef}
 * members.
 */
public record ClassDef(
    Position pos,
    Ident name,
    Tree parent,  // EmptyTree when the class has no superclass
    List<Tree> defs
) implements Tree {
    public ClassDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parent, "parent");
        defs = List.copyOf(defs);
    }
}
