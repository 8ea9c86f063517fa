package com.jsir.ast;

import java.util.List;
import java.util.Objects;

/**
 * Object literal. Fields keep their order and may repeat a key.
 */
public record ObjectConstr(
    Position pos,
    List<Field> fields
) implements Tree {
    public ObjectConstr {
        fields = List.copyOf(fields);
    }

    public record Field(PropertyName name, Tree value) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }
}
