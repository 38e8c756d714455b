package com.graphgate.config;

import com.graphgate.config.schema.Field;
import com.graphgate.config.transcode.Blueprint;
import com.graphgate.config.transcode.TranscodeException;
import com.graphgate.config.transcode.Transcoder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root gateway configuration: format version, server settings and the GraphQL schema with
 * per-field resolution steps. Immutable; every operation returns a new value.
 * <p>
 * Several configurations are layered with {@link #mergeRight(GatewayConfiguration)} and the result
 * can be shrunk to its minimal serialized form with {@link #compress()}.
 */
public final class GatewayConfiguration {

    private static final GatewayConfiguration EMPTY =
            new GatewayConfiguration(0, ServerConfig.empty(), GraphQLConfig.empty());

    private final int version;
    private final ServerConfig server;
    private final GraphQLConfig graphQL;

    public GatewayConfiguration(int version, ServerConfig server, GraphQLConfig graphQL) {
        this.version = version;
        this.server = server != null ? server : ServerConfig.empty();
        this.graphQL = graphQL != null ? graphQL : GraphQLConfig.empty();
    }

    /** Version 0, no server settings, no types. */
    public static GatewayConfiguration empty() {
        return EMPTY;
    }

    /**
     * Folds configurations left to right with {@link #mergeRight}, starting from {@link #empty()}.
     * Later entries win.
     */
    public static GatewayConfiguration mergeAll(List<GatewayConfiguration> configurations) {
        GatewayConfiguration result = EMPTY;
        for (GatewayConfiguration c : configurations) {
            result = result.mergeRight(c);
        }
        return result;
    }

    public int getVersion() {
        return version;
    }

    public ServerConfig getServer() {
        return server;
    }

    public GraphQLConfig getGraphQL() {
        return graphQL;
    }

    /**
     * Layers {@code other} on top of this configuration. The version is always {@code other}'s;
     * base URL and root operation names are {@code other}'s when set; a type defined on both sides
     * is taken whole from {@code other} (see {@link GraphQLConfig#mergeRight}).
     */
    public GatewayConfiguration mergeRight(GatewayConfiguration other) {
        Objects.requireNonNull(other, "other");
        return new GatewayConfiguration(
                other.version,
                server.mergeRight(other.server),
                graphQL.mergeRight(other.graphQL));
    }

    /** Minimal equivalent configuration; idempotent. */
    public GatewayConfiguration compress() {
        return new GatewayConfiguration(version, server, graphQL.compress());
    }

    /**
     * Builds the executable blueprint without encoded steps.
     *
     * @see #toBlueprint(Transcoder, boolean)
     */
    public Blueprint toBlueprint(Transcoder transcoder) throws TranscodeException {
        return toBlueprint(transcoder, false);
    }

    /**
     * Builds the executable blueprint with the given transcoder. Runtime failures and a missing
     * result from the transcoder are reported as {@link TranscodeException}.
     */
    public Blueprint toBlueprint(Transcoder transcoder, boolean encodeSteps) throws TranscodeException {
        Objects.requireNonNull(transcoder, "transcoder");
        Blueprint blueprint;
        try {
            blueprint = transcoder.toBlueprint(this, encodeSteps);
        } catch (RuntimeException e) {
            throw new TranscodeException("Transcoder failed for configuration version " + version + ": " + e.getMessage(), e);
        }
        if (blueprint == null) {
            throw new TranscodeException("Transcoder returned no blueprint for configuration version " + version);
        }
        return blueprint;
    }

    public GatewayConfiguration withVersion(int version) {
        return new GatewayConfiguration(version, server, graphQL);
    }

    public GatewayConfiguration withServer(ServerConfig server) {
        return new GatewayConfiguration(version, server, graphQL);
    }

    public GatewayConfiguration withBaseUrl(AbsoluteUrl baseUrl) {
        return new GatewayConfiguration(version, server.withBaseUrl(baseUrl), graphQL);
    }

    public GatewayConfiguration withGraphQL(GraphQLConfig graphQL) {
        return new GatewayConfiguration(version, server, graphQL);
    }

    public GatewayConfiguration withQuery(String query) {
        return new GatewayConfiguration(version, server, graphQL.withQuery(query));
    }

    public GatewayConfiguration withMutation(String mutation) {
        return new GatewayConfiguration(version, server, graphQL.withMutation(mutation));
    }

    public GatewayConfiguration withRootSchema(String query, String mutation) {
        return new GatewayConfiguration(version, server, graphQL.withSchema(query, mutation));
    }

    public GatewayConfiguration withType(String name, Map<String, Field> fields) {
        return new GatewayConfiguration(version, server, graphQL.withType(name, fields));
    }

    public GatewayConfiguration withTypes(Map<String, Map<String, Field>> types) {
        return new GatewayConfiguration(version, server, graphQL.withTypes(types));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GatewayConfiguration that = (GatewayConfiguration) o;
        return version == that.version
                && Objects.equals(server, that.server)
                && Objects.equals(graphQL, that.graphQL);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, server, graphQL);
    }

    @Override
    public String toString() {
        return "GatewayConfiguration{version=" + version + ", server=" + server + ", graphQL=" + graphQL + "}";
    }
}
