package com.jsir.ast;

/**
 * Thrown when an {@link Ident} is built from a name that is not a valid identifier.
 */
public class InvalidIdentifierException extends IllegalArgumentException {

    private final String name;

    public InvalidIdentifierException(String name) {
        super("'" + name + "' is not a valid identifier");
        this.name = name;
    }

    /**
     * The offending name, possibly empty or null.
     */
    public String name() {
        return name;
    }
}
