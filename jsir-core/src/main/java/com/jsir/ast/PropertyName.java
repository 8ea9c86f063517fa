package com.jsir.ast;

/**
 * A key of a named member access or of an object literal field.
 *
 * <p>The same key has two physical encodings: a bare {@link Ident} ({@code o.foo}, {@code {foo: 1}})
 * or a {@link StringLiteral} ({@code o["a-b"]}, {@code {"a-b": 1}}). {@link #name()} hides the
 * difference.</p>
 */
public sealed interface PropertyName extends Tree permits Ident, StringLiteral {

    String name();

    /**
     * Creates the canonical encoding of {@code name}: an {@link Ident} when {@code name} is a valid
     * identifier, a {@link StringLiteral} otherwise. Never fails.
     */
    static PropertyName of(String name, Position pos) {
        if (Identifiers.isValid(name)) {
            return new Ident(pos, name);
        }
        return new StringLiteral(pos, name);
    }

    /**
     * Returns the key as a string, whichever encoding {@code property} uses.
     */
    static String nameOf(PropertyName property) {
        return property.name();
    }
}
