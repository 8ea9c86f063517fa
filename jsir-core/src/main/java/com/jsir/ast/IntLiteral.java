package com.jsir.ast;

public record IntLiteral(
    Position pos,
    long value
) implements Literal {
    public IntLiteral(long value) {
        this(Position.NO_POSITION, value);
    }
}
