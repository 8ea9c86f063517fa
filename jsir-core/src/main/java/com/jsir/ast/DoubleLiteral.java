package com.jsir.ast;

public record DoubleLiteral(
    Position pos,
    double value
) implements Literal {
}
