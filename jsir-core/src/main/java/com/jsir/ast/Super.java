package com.jsir.ast;

public record Super(Position pos) implements Tree {
}
