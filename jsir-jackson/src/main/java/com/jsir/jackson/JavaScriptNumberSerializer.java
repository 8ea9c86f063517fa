package com.jsir.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Serializes numeric literal values. Non-finite doubles have no JSON number form, so they are written
 * as the strings JavaScript prints for them ({@code "NaN"}, {@code "Infinity"}, {@code "-Infinity"}),
 * which Jackson reads back into the same double.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Number> {
    @Override
    public void serialize(Number value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            if (d.isNaN()) {
                gen.writeString("NaN");
            } else if (d.isInfinite()) {
                gen.writeString(d > 0 ? "Infinity" : "-Infinity");
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else {
            gen.writeNumber(value.doubleValue());
        }
    }
}
