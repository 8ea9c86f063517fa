package com.jsir.ast;

public record Break(Position pos) implements Tree {
}
