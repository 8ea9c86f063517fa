package com.jsir.ast;

public record Null(Position pos) implements Literal {
}
