package com.architecture.memory.palace.service.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A finalized query: Cypher text plus the parameters it references. Immutable and safe to share
 * between threads; the only way to get a different plan is to build a new query.
 */
public record QueryPlan(String text, Map<String, Object> parameters) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public QueryPlan {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query text must not be blank");
        }
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * {@code {"text": "...", "params": {...}}}, the shape handed to external drivers.
     */
    public String toJson() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("text", text);
        document.put("params", parameters);
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize query plan: " + e.getMessage(), e);
        }
    }
}
