package com.jsir.ast;

public record Undefined(Position pos) implements Literal {
}
