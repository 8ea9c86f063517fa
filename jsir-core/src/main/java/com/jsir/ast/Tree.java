package com.jsir.ast;

/**
 * Base interface for all JavaScript tree nodes.
 *
 * <p>Trees are immutable and strictly tree-shaped: a node is owned by exactly one parent.
 * Rewrites always build new nodes, see {@link com.jsir.transform.Transformer}.</p>
 */
public sealed interface Tree permits
    EmptyTree,
    PropertyName,
    Literal,
    VarDef,
    FunDef,
    Skip,
    Block,
    Assign,
    Return,
    If,
    While,
    Try,
    Throw,
    Break,
    Continue,
    DotSelect,
    BracketSelect,
    Apply,
    Function,
    UnaryOp,
    BinaryOp,
    New,
    This,
    ArrayConstr,
    ObjectConstr,
    ClassDef,
    MethodDef,
    GetterDef,
    SetterDef,
    Super {

    Position pos();
}
