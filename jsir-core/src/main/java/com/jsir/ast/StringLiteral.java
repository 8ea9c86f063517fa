package com.jsir.ast;

public record StringLiteral(
    Position pos,
    String value
) implements Literal, PropertyName {
    public StringLiteral(String value) {
        this(Position.NO_POSITION, value);
    }

    @Override
    public String name() {
        return value;
    }
}
