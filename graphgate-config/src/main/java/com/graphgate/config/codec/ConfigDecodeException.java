package com.graphgate.config.codec;

/**
 * Thrown when JSON cannot be decoded into a gateway configuration. Carries the JSON path of the
 * offending value (e.g. {@code $.graphQL.types.Query.user.steps[0].http.method}) and the reason.
 */
public final class ConfigDecodeException extends Exception {

    private final String path;
    private final String reason;

    public ConfigDecodeException(String path, String reason) {
        super(path + ": " + reason);
        this.path = path;
        this.reason = reason;
    }

    public ConfigDecodeException(String path, String reason, Throwable cause) {
        super(path + ": " + reason, cause);
        this.path = path;
        this.reason = reason;
    }

    /** JSON path of the value that failed to decode; {@code $} is the document root. */
    public String getPath() {
        return path;
    }

    /** Why decoding failed, without the path. */
    public String getReason() {
        return reason;
    }
}
