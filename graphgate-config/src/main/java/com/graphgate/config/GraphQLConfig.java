package com.graphgate.config;

import com.graphgate.config.schema.Field;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * GraphQL part of the configuration: root operation names and the type registry
 * (type name → field name → {@link Field}).
 */
public final class GraphQLConfig {

    private static final GraphQLConfig EMPTY = new GraphQLConfig(RootSchema.empty(), Map.of());

    private final RootSchema schema;
    private final Map<String, Map<String, Field>> types;

    public GraphQLConfig(RootSchema schema, Map<String, Map<String, Field>> types) {
        this.schema = schema != null ? schema : RootSchema.empty();
        this.types = copyTypes(types);
    }

    public static GraphQLConfig empty() {
        return EMPTY;
    }

    public RootSchema getSchema() {
        return schema;
    }

    /** Type registry; keys are type names, values are field maps keyed by field name. Never null. */
    public Map<String, Map<String, Field>> getTypes() {
        return types;
    }

    /** Fields of the named type; null when the type is not registered. */
    public Map<String, Field> getType(String name) {
        return types.get(name);
    }

    public GraphQLConfig withSchema(String query, String mutation) {
        return new GraphQLConfig(new RootSchema(query, mutation), types);
    }

    public GraphQLConfig withQuery(String name) {
        return new GraphQLConfig(schema.withQuery(name), types);
    }

    public GraphQLConfig withMutation(String name) {
        return new GraphQLConfig(schema.withMutation(name), types);
    }

    /** Adds the type, replacing any existing type with the same name. */
    public GraphQLConfig withType(String name, Map<String, Field> fields) {
        Map<String, Map<String, Field>> updated = new LinkedHashMap<>(types);
        updated.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(fields, "fields"));
        return new GraphQLConfig(schema, updated);
    }

    /** Adds all types, replacing existing types with the same names. */
    public GraphQLConfig withTypes(Map<String, Map<String, Field>> added) {
        Map<String, Map<String, Field>> updated = new LinkedHashMap<>(types);
        updated.putAll(Objects.requireNonNull(added, "types"));
        return new GraphQLConfig(schema, updated);
    }

    /**
     * Right-biased merge. Root operation names fall back to this config when {@code other} leaves
     * them unset. Types are a shallow union by name: a type present on both sides takes
     * {@code other}'s whole field map; fields of a shared type are not merged one by one.
     */
    public GraphQLConfig mergeRight(GraphQLConfig other) {
        Objects.requireNonNull(other, "other");
        Map<String, Map<String, Field>> merged = new LinkedHashMap<>(types);
        merged.putAll(other.types);
        return new GraphQLConfig(schema.mergeRight(other.schema), merged);
    }

    public GraphQLConfig compress() {
        Map<String, Map<String, Field>> compressed = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Field>> type : types.entrySet()) {
            Map<String, Field> fields = new LinkedHashMap<>();
            type.getValue().forEach((name, field) -> fields.put(name, field.compress()));
            compressed.put(type.getKey(), fields);
        }
        return new GraphQLConfig(schema, compressed);
    }

    private static Map<String, Map<String, Field>> copyTypes(Map<String, Map<String, Field>> types) {
        if (types == null || types.isEmpty()) return Map.of();
        Map<String, Map<String, Field>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Field>> e : types.entrySet()) {
            Map<String, Field> fields = e.getValue() != null ? e.getValue() : Map.of();
            copy.put(Objects.requireNonNull(e.getKey(), "type name"),
                    Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphQLConfig that = (GraphQLConfig) o;
        return Objects.equals(schema, that.schema) && Objects.equals(types, that.types);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, types);
    }

    @Override
    public String toString() {
        return "GraphQLConfig{schema=" + schema + ", types=" + types + "}";
    }
}
