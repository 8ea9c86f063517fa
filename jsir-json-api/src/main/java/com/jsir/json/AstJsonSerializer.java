package com.jsir.json;

import com.jsir.ast.Tree;

/**
 * Writes trees as JSON.
 *
 * <p>Every node becomes an object with a {@code "type"} discriminator (the node's simple class name)
 * followed by its components. Positions equal to {@code Position.NO_POSITION} are omitted.</p>
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Tree tree) throws AstJsonException;

    /**
     * Same as {@link #serialize(Tree)}, indented for humans.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Tree tree) throws AstJsonException;
}
