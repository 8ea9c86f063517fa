package com.jsir.ast;

import java.util.List;
import java.util.Optional;

/**
 * Method call {@code receiver.method(args)}, recognized as an {@link Apply} whose callee is a
 * {@link Select}.
 */
public record ApplyMethod(Tree receiver, PropertyName method, List<Tree> args) {
    public ApplyMethod {
        args = List.copyOf(args);
    }

    public static Apply of(Tree receiver, PropertyName method, List<Tree> args, Position pos) {
        return new Apply(pos, Select.of(receiver, method, pos), args);
    }

    public static Optional<ApplyMethod> unapply(Tree tree) {
        if (!(tree instanceof Apply apply)) {
            return Optional.empty();
        }
        return Select.unapply(apply.fun())
            .map(select -> new ApplyMethod(select.qualifier(), select.property(), apply.args()));
    }
}
