package com.jsir.ast;

import java.util.Optional;

/**
 * Named member access, independent of its physical encoding.
 *
 * <p>{@code o.foo} is a {@link DotSelect}; {@code o["a-b"]} is a {@link BracketSelect} with a
 * {@link StringLiteral} key. Both are matched by {@link #unapply(Tree)}. Computed accesses such as
 * {@code o[i]} are not named accesses and do not match.</p>
 */
public record Select(Tree qualifier, PropertyName property) {

    /**
     * Builds the canonical access: a {@link DotSelect} whenever the property name is a valid
     * identifier, a {@link BracketSelect} otherwise.
     */
    public static Tree of(Tree qualifier, PropertyName property, Position pos) {
        if (property instanceof Ident ident) {
            return new DotSelect(pos, qualifier, ident);
        }
        StringLiteral literal = (StringLiteral) property;
        if (Identifiers.isValid(literal.value())) {
            return new DotSelect(pos, qualifier, new Ident(literal.pos(), literal.value()));
        }
        return new BracketSelect(pos, qualifier, literal);
    }

    public static Optional<Select> unapply(Tree tree) {
        if (tree instanceof DotSelect dot) {
            return Optional.of(new Select(dot.qualifier(), dot.item()));
        }
        if (tree instanceof BracketSelect bracket && bracket.item() instanceof StringLiteral key) {
            return Optional.of(new Select(bracket.qualifier(), key));
        }
        return Optional.empty();
    }
}
