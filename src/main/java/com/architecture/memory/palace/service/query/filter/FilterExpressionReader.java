package com.architecture.memory.palace.service.query.filter;

import com.architecture.memory.palace.exception.InvalidFilterShapeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads JSON filter documents into the nested map understood by {@link FilterCompiler}.
 * Key order is preserved so parameter numbering follows the document.
 */
@RequiredArgsConstructor
public class FilterExpressionReader {

    private static final TypeReference<LinkedHashMap<String, Object>> EXPRESSION_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public FilterExpressionReader() {
        this(new ObjectMapper());
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root.isNull()) {
                return Map.of();
            }
            if (!root.isObject()) {
                throw new InvalidFilterShapeException("$", "filter document must be a JSON object");
            }
            return objectMapper.convertValue(root, EXPRESSION_TYPE);
        } catch (JsonProcessingException e) {
            throw new InvalidFilterShapeException("$", "malformed JSON: " + e.getOriginalMessage());
        }
    }
}
