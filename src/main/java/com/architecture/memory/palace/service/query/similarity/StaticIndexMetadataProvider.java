package com.architecture.memory.palace.service.query.similarity;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable index metadata value, built from configuration or from a database snapshot.
 */
public final class StaticIndexMetadataProvider implements IndexMetadataProvider {

    private final Map<String, Integer> dimensions;

    public StaticIndexMetadataProvider(Map<String, Integer> dimensions) {
        dimensions.forEach((name, size) -> {
            if (size == null || size <= 0) {
                throw new IllegalArgumentException("Index " + name + " has invalid dimensions: " + size);
            }
        });
        this.dimensions = Map.copyOf(dimensions);
    }

    public static StaticIndexMetadataProvider empty() {
        return new StaticIndexMetadataProvider(Map.of());
    }

    public static StaticIndexMetadataProvider of(String indexName, int dimensions) {
        Map<String, Integer> map = new HashMap<>();
        map.put(indexName, dimensions);
        return new StaticIndexMetadataProvider(map);
    }

    @Override
    public OptionalInt dimensionsFor(String indexName) {
        Integer size = dimensions.get(indexName);
        return size == null ? OptionalInt.empty() : OptionalInt.of(size);
    }

    public Map<String, Integer> asMap() {
        return dimensions;
    }
}
