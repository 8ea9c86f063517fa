package com.jsir.ast;

public record Continue(Position pos) implements Tree {
}
