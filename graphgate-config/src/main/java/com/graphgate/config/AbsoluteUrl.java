package com.graphgate.config;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Objects;

/**
 * Absolute URL value (e.g. the gateway base URL). Parsing is strict: the value must be an absolute,
 * hierarchical URL with a scheme that {@link URL} can open; http and https URLs also need an authority.
 * Hosts that {@link URI} does not treat as server names (e.g. {@code user_service}) are accepted. {@link #toString()} returns the
 * exact string that was parsed, so parse and format round-trip.
 * <p>
 * Equality compares the string form; unlike {@link URL#equals(Object)} it never resolves hosts.
 */
public final class AbsoluteUrl {

    private final URI uri;

    private AbsoluteUrl(URI uri) {
        this.uri = uri;
    }

    /**
     * Parses an absolute URL.
     *
     * @param value raw string (e.g. {@code https://api.example.com/v1})
     * @return parsed URL
     * @throws IllegalArgumentException with message {@code Malformed url: <value>} when the value is not an absolute URL
     */
    public static AbsoluteUrl parse(String value) {
        if (value == null || value.isBlank()) {
            throw malformed(value);
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw malformed(value, e);
        }
        if (!uri.isAbsolute() || uri.isOpaque() || (isHttp(uri) && uri.getRawAuthority() == null)) {
            throw malformed(value);
        }
        try {
            uri.toURL();
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw malformed(value, e);
        }
        return new AbsoluteUrl(uri);
    }

    private static boolean isHttp(URI uri) {
        return "http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme());
    }

    private static IllegalArgumentException malformed(String value) {
        return new IllegalArgumentException("Malformed url: " + value);
    }

    private static IllegalArgumentException malformed(String value, Exception cause) {
        return new IllegalArgumentException("Malformed url: " + value, cause);
    }

    public URI toUri() {
        return uri;
    }

    /** The URL form, for HTTP clients that still take {@link URL}. */
    public URL toUrl() {
        try {
            return uri.toURL();
        } catch (MalformedURLException e) {
            throw new IllegalStateException("URL validated at parse time: " + uri, e);
        }
    }

    /** Host as {@link URL} reads it; empty for URLs without one (e.g. {@code file:///etc}). */
    public String getHost() {
        return toUrl().getHost();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AbsoluteUrl that = (AbsoluteUrl) o;
        return uri.toString().equals(that.uri.toString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri.toString());
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
