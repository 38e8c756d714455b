package com.graphgate.config.step;

/**
 * HTTP method of an {@link HttpStep}. JSON uses the upper-case name.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS,
    TRACE,
    CONNECT;

    /** Method used when a step does not declare one. */
    public static final HttpMethod DEFAULT = GET;

    /**
     * Resolves a method from its name, ignoring case and surrounding whitespace.
     *
     * @return the method, or null when {@code value} is blank or not a known method
     */
    public static HttpMethod fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toUpperCase();
        for (HttpMethod m : values()) {
            if (m.name().equals(normalized)) return m;
        }
        return null;
    }
}
