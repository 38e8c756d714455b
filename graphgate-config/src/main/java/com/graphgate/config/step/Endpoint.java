package com.graphgate.config.step;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Execution-layer description of an upstream HTTP operation. Consumed one-way by
 * {@link HttpStep#fromEndpoint(Endpoint)}; nothing here performs a call.
 *
 * @param path   templated URL path (e.g. {@code /users/{{args.id}}})
 * @param method HTTP method
 * @param input  request shape; null = unknown
 * @param output response shape; null = unknown
 */
public record Endpoint(String path, HttpMethod method, JsonNode input, JsonNode output) {

    public Endpoint {
        Objects.requireNonNull(path, "path");
        method = method != null ? method : HttpMethod.DEFAULT;
        input = JsonValues.canonical(input);
        output = JsonValues.canonical(output);
    }

    public static Endpoint get(String path) {
        return new Endpoint(path, HttpMethod.GET, null, null);
    }
}
