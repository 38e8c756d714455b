package com.graphgate.config.step;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Calls an upstream HTTP endpoint.
 *
 * @param path   templated URL path, resolved against the server base URL
 * @param method HTTP method; null = {@link HttpMethod#DEFAULT}
 * @param input  structural schema of the request; null = not declared
 * @param output structural schema of the response; null = not declared
 */
public record HttpStep(String path, HttpMethod method, JsonNode input, JsonNode output) implements Step {

    public HttpStep {
        Objects.requireNonNull(path, "path");
        input = JsonValues.canonical(input);
        output = JsonValues.canonical(output);
    }

    public static HttpStep of(String path) {
        return new HttpStep(path, null, null, null);
    }

    /** Copies path, method and schemas of an endpoint description. */
    public static HttpStep fromEndpoint(Endpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        return new HttpStep(endpoint.path(), endpoint.method(), endpoint.input(), endpoint.output());
    }

    @Override
    public JsonNode input() {
        return input != null ? input.deepCopy() : null;
    }

    @Override
    public JsonNode output() {
        return output != null ? output.deepCopy() : null;
    }

    /** The declared method, or GET when none is declared. */
    public HttpMethod effectiveMethod() {
        return method != null ? method : HttpMethod.DEFAULT;
    }

    public HttpStep withMethod(HttpMethod method) {
        return new HttpStep(path, method, input, output);
    }

    public HttpStep withInput(JsonNode input) {
        return new HttpStep(path, method, input, output);
    }

    public HttpStep withOutput(JsonNode output) {
        return new HttpStep(path, method, input, output);
    }

    /**
     * Drops the input and output schemas (the transcoder derives them) and a GET method (the default).
     */
    @Override
    public HttpStep compress() {
        return new HttpStep(path, method == HttpMethod.GET ? null : method, null, null);
    }
}
