package com.jsir.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = JsirJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(tree);
 * Tree tree = mapper.readValue(json, Tree.class);
 * </pre>
 */
public final class JsirJackson {

    private JsirJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for tree serialization/deserialization.
     *
     * The returned mapper:
     * - Names each node's concrete type in a "type" property
     * - Omits null values (e.g. a position without source name)
     * - Omits pos for nodes without a source position, and restores it when reading
     * - Writes nodes without components, such as EmptyTree, as a bare typed object
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
