package com.graphgate.config.step;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects fields of an upstream object into the target shape. Each entry maps an output field
 * name to the path segments navigated in the source object (e.g. {@code "city" -> ["address", "city"]}).
 */
public record ObjPathStep(Map<String, List<String>> map) implements Step {

    public ObjPathStep {
        if (map == null || map.isEmpty()) {
            map = Map.of();
        } else {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            map.forEach((name, path) -> copy.put(name, path != null ? List.copyOf(path) : List.of()));
            map = Map.copyOf(copy);
        }
    }

    /** Single-entry projection. */
    public static ObjPathStep of(String name, String... path) {
        return new ObjPathStep(Map.of(name, List.of(path)));
    }

    public ObjPathStep with(String name, List<String> path) {
        Map<String, List<String>> updated = new LinkedHashMap<>(map);
        updated.put(name, path);
        return new ObjPathStep(updated);
    }

    @Override
    public ObjPathStep compress() {
        return this;
    }
}
