package com.jsir.ast;

import java.util.Optional;

public record Ident(
    Position pos,
    String name
) implements PropertyName {
    public Ident {
        Identifiers.requireValid(name);
    }

    public Ident(String name) {
        this(Position.NO_POSITION, name);
    }

    /**
     * Non-throwing variant of the constructor.
     */
    public static Optional<Ident> tryOf(String name, Position pos) {
        if (!Identifiers.isValid(name)) {
            return Optional.empty();
        }
        return Optional.of(new Ident(pos, name));
    }
}
