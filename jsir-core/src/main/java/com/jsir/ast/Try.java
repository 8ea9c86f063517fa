package com.jsir.ast;

import java.util.Objects;

/**
 * {@code try { block } catch (errVar) { handler } finally { finalizer }}.
 *
 * <p>The finalizer never produces a value, so it is always in statement position.</p>
 */
public record Try(
    Position pos,
    Tree block,
    Ident errVar,
    Tree handler,
    Tree finalizer  // EmptyTree when there is no finally clause
) implements Tree {
    public Try {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(errVar, "errVar");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(finalizer, "finalizer");
    }
}
