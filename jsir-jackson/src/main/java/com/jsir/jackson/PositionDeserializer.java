package com.jsir.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.jsir.ast.Position;

import java.io.IOException;

/**
 * Reads {@code {"source": .., "line": .., "column": ..}}. A missing or null {@code pos} means
 * {@link Position#NO_POSITION}, which the serializer never writes.
 */
public class PositionDeserializer extends StdDeserializer<Position> {

    public PositionDeserializer() {
        super(Position.class);
    }

    @Override
    public Position deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || !node.isObject()) {
            return Position.NO_POSITION;
        }
        String source = node.hasNonNull("source") ? node.get("source").asText() : null;
        int line = node.path("line").asInt(0);
        int column = node.path("column").asInt(0);
        return new Position(source, line, column);
    }

    @Override
    public Position getNullValue(DeserializationContext ctxt) {
        return Position.NO_POSITION;
    }

    @Override
    public Object getAbsentValue(DeserializationContext ctxt) {
        return Position.NO_POSITION;
    }
}
