package com.architecture.memory.palace.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One recalled memory node. The embedding is not included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryHit {

    private String id;
    private String content;
    private List<String> labels;
    private Map<String, Object> properties;

    /**
     * Similarity score, null for filtered recall
     */
    private Double similarity;
}
