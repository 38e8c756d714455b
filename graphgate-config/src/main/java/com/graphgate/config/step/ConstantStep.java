package com.graphgate.config.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Returns a literal JSON value for the field. A JSON {@code null} literal is a valid constant.
 */
public record ConstantStep(JsonNode json) implements Step {

    public ConstantStep {
        json = json != null ? JsonValues.canonical(json) : NullNode.getInstance();
    }

    @Override
    public JsonNode json() {
        return json.deepCopy();
    }

    @Override
    public ConstantStep compress() {
        return this;
    }
}
