package com.jsir.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.jsir.ast.*;

/**
 * Polymorphic type handling for {@link Tree}: the concrete node is named by a {@code "type"} property
 * holding the record's simple name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EmptyTree.class, name = "EmptyTree"),
    @JsonSubTypes.Type(value = Ident.class, name = "Ident"),
    @JsonSubTypes.Type(value = VarDef.class, name = "VarDef"),
    @JsonSubTypes.Type(value = FunDef.class, name = "FunDef"),
    @JsonSubTypes.Type(value = Skip.class, name = "Skip"),
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = Assign.class, name = "Assign"),
    @JsonSubTypes.Type(value = Return.class, name = "Return"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = While.class, name = "While"),
    @JsonSubTypes.Type(value = Try.class, name = "Try"),
    @JsonSubTypes.Type(value = Throw.class, name = "Throw"),
    @JsonSubTypes.Type(value = Break.class, name = "Break"),
    @JsonSubTypes.Type(value = Continue.class, name = "Continue"),
    @JsonSubTypes.Type(value = DotSelect.class, name = "DotSelect"),
    @JsonSubTypes.Type(value = BracketSelect.class, name = "BracketSelect"),
    @JsonSubTypes.Type(value = Apply.class, name = "Apply"),
    @JsonSubTypes.Type(value = Function.class, name = "Function"),
    @JsonSubTypes.Type(value = UnaryOp.class, name = "UnaryOp"),
    @JsonSubTypes.Type(value = BinaryOp.class, name = "BinaryOp"),
    @JsonSubTypes.Type(value = New.class, name = "New"),
    @JsonSubTypes.Type(value = This.class, name = "This"),
    @JsonSubTypes.Type(value = Undefined.class, name = "Undefined"),
    @JsonSubTypes.Type(value = Null.class, name = "Null"),
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
    @JsonSubTypes.Type(value = IntLiteral.class, name = "IntLiteral"),
    @JsonSubTypes.Type(value = DoubleLiteral.class, name = "DoubleLiteral"),
    @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
    @JsonSubTypes.Type(value = ArrayConstr.class, name = "ArrayConstr"),
    @JsonSubTypes.Type(value = ObjectConstr.class, name = "ObjectConstr"),
    @JsonSubTypes.Type(value = ClassDef.class, name = "ClassDef"),
    @JsonSubTypes.Type(value = MethodDef.class, name = "MethodDef"),
    @JsonSubTypes.Type(value = GetterDef.class, name = "GetterDef"),
    @JsonSubTypes.Type(value = SetterDef.class, name = "SetterDef"),
    @JsonSubTypes.Type(value = Super.class, name = "Super")
})
public abstract class TreeMixin {
}
