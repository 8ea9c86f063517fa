package com.jsir.ast;

public record This(Position pos) implements Tree {
}
