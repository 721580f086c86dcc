package com.architecture.memory.palace.service.query;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ordered collection of query parameters. This is the only place literal values live;
 * query text references them as {@code $p0}, {@code $p1}, ...
 *
 * Names come from a monotonic counter and are never reused once they reach a clause. When
 * created deduplicating, binding an identical immutable scalar twice returns the name bound
 * the first time.
 *
 * A bag belongs to one query under construction and is not thread-safe.
 */
public class ParameterBag {

    private static final String PREFIX = "p";

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<Object, String> scalarNames = new HashMap<>();
    private final boolean deduplicating;
    private int counter;

    public ParameterBag() {
        this(true);
    }

    public ParameterBag(boolean deduplicating) {
        this.deduplicating = deduplicating;
    }

    /**
     * Bind a value and return the parameter name (without the leading {@code $}).
     *
     * @throws IllegalArgumentException if the value is null or of a type the driver cannot bind
     */
    public String bind(Object value) {
        Object normalized = normalize(value, "parameter");

        if (deduplicating && isScalar(normalized)) {
            String existing = scalarNames.get(new ScalarKey(normalized));
            if (existing != null) {
                return existing;
            }
        }

        String name = PREFIX + counter++;
        values.put(name, normalized);
        if (deduplicating && isScalar(normalized)) {
            scalarNames.put(new ScalarKey(normalized), name);
        }
        return name;
    }

    /**
     * Bind a value and return its placeholder, e.g. {@code $p3}.
     */
    public String placeholder(Object value) {
        return "$" + bind(value);
    }

    /**
     * Re-bind every value of another bag into this one. The other bag's names mean nothing here,
     * so the caller must rewrite references with the returned mapping.
     *
     * @return foreign name to the name the same value has in this bag, in binding order
     */
    public Map<String, String> merge(ParameterBag other) {
        Map<String, String> renames = new LinkedHashMap<>();
        other.values.forEach((name, value) -> renames.put(name, bind(value)));
        return renames;
    }

    /**
     * Drop every parameter bound after the bag had {@code size} entries. Used when a clause fails
     * half-way so that its values do not end up in the query.
     */
    void rollback(int size) {
        if (size < 0 || size > values.size()) {
            throw new IllegalArgumentException("Cannot roll back to " + size + " of " + values.size() + " parameters");
        }
        while (counter > size) {
            String name = PREFIX + --counter;
            Object value = values.remove(name);
            if (value != null && isScalar(value)) {
                scalarNames.remove(new ScalarKey(value), name);
            }
        }
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static Object normalize(Object value, String path) {
        if (value == null) {
            throw new IllegalArgumentException("Null cannot be bound as a query parameter (" + path + ")");
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean
                || value instanceof Temporal || value instanceof float[] || value instanceof double[]) {
            return value;
        }
        if (value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            int i = 0;
            for (Object element : collection) {
                copy.add(normalize(element, path + "[" + i++ + "]"));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Map parameters need string keys (" + path + ")");
                }
                copy.put(key, normalize(entry.getValue(), path + "." + key));
            }
            return Collections.unmodifiableMap(copy);
        }
        throw new IllegalArgumentException(String.format(
                "Unsupported parameter type %s (%s)", value.getClass().getName(), path));
    }

    /**
     * Type-exact key so that 1, 1L and 1.0 never share a parameter.
     */
    private record ScalarKey(Class<?> type, Object value) {
        ScalarKey(Object value) {
            this(value.getClass(), value);
        }
    }
}
