package com.jsir.json;

import com.jsir.ast.Tree;

/**
 * Reads trees back from the JSON written by {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a tree of any kind.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized tree
     * @throws AstJsonException if the JSON is malformed or describes an invalid tree,
     *                          e.g. an identifier with an illegal name
     */
    Tree deserialize(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Tree> T deserialize(String json, Class<T> type) throws AstJsonException;
}
