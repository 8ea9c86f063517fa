package com.jsir.ast;

public record BooleanLiteral(
    Position pos,
    boolean value
) implements Literal {
}
