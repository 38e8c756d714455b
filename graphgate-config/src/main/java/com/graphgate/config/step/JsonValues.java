package com.graphgate.config.step;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Canonical copies of JSON payloads held by steps. A payload is written and read back so its number
 * nodes have the types the JSON parser produces (e.g. a {@code LongNode} 42 becomes an {@code IntNode},
 * a {@code FloatNode} a {@code DoubleNode}); a configuration then equals its own decoded JSON text.
 */
final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonValues() {
    }

    /**
     * @return a detached canonical copy, or null for null
     * @throws IllegalArgumentException when the value has no JSON text form (e.g. a NaN number)
     */
    static JsonNode canonical(JsonNode value) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.readTree(MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON value: " + value, e);
        }
    }
}
