package com.graphgate.config;

import java.util.Objects;

/**
 * Gateway-level settings. Currently only an optional base URL override for upstream calls.
 */
public final class ServerConfig {

    private static final ServerConfig EMPTY = new ServerConfig(null);

    private final AbsoluteUrl baseUrl;

    public ServerConfig(AbsoluteUrl baseUrl) {
        this.baseUrl = baseUrl;
    }

    public static ServerConfig empty() {
        return EMPTY;
    }

    /** Base URL for upstream HTTP steps; null = not set. */
    public AbsoluteUrl getBaseUrl() {
        return baseUrl;
    }

    public boolean isEmpty() {
        return baseUrl == null;
    }

    public ServerConfig withBaseUrl(AbsoluteUrl baseUrl) {
        return new ServerConfig(baseUrl);
    }

    /** Right-biased: {@code other}'s base URL when set, otherwise this one. */
    public ServerConfig mergeRight(ServerConfig other) {
        Objects.requireNonNull(other, "other");
        return new ServerConfig(other.baseUrl != null ? other.baseUrl : baseUrl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerConfig that = (ServerConfig) o;
        return Objects.equals(baseUrl, that.baseUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseUrl);
    }

    @Override
    public String toString() {
        return "ServerConfig{baseUrl=" + baseUrl + "}";
    }
}
