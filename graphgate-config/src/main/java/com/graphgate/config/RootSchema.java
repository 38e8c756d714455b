package com.graphgate.config;

import java.util.Objects;

/** Names of the GraphQL root operation types. Either may be null (not declared). */
public final class RootSchema {

    private static final RootSchema EMPTY = new RootSchema(null, null);

    private final String query;
    private final String mutation;

    public RootSchema(String query, String mutation) {
        this.query = query;
        this.mutation = mutation;
    }

    public static RootSchema empty() {
        return EMPTY;
    }

    /** Name of the root Query type; null = not declared. */
    public String getQuery() {
        return query;
    }

    /** Name of the root Mutation type; null = not declared. */
    public String getMutation() {
        return mutation;
    }

    public RootSchema withQuery(String query) {
        return new RootSchema(query, mutation);
    }

    public RootSchema withMutation(String mutation) {
        return new RootSchema(query, mutation);
    }

    /** Query and mutation are resolved independently: {@code other}'s value when set, otherwise this one. */
    public RootSchema mergeRight(RootSchema other) {
        Objects.requireNonNull(other, "other");
        return new RootSchema(
                other.query != null ? other.query : query,
                other.mutation != null ? other.mutation : mutation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RootSchema that = (RootSchema) o;
        return Objects.equals(query, that.query) && Objects.equals(mutation, that.mutation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, mutation);
    }

    @Override
    public String toString() {
        return "RootSchema{query=" + query + ", mutation=" + mutation + "}";
    }
}
