package com.jsir.ast;

public record Skip(Position pos) implements Tree {
}
