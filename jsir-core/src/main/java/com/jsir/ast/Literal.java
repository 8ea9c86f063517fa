package com.jsir.ast;

/**
 * Literal values. {@link StringLiteral} doubles as a {@link PropertyName}.
 */
public sealed interface Literal extends Tree permits
    Undefined,
    Null,
    BooleanLiteral,
    IntLiteral,
    DoubleLiteral,
    StringLiteral {
}
