package com.jsir.ast;

import java.util.List;

public record ArrayConstr(
    Position pos,
    List<Tree> items
) implements Tree {
    public ArrayConstr {
        items = List.copyOf(items);
    }
}
