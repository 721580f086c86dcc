package com.architecture.memory.palace.dto;

import com.architecture.memory.palace.service.query.similarity.SimilarityRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for memory recall
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemorySearchRequest {

    /**
     * Structural filter expression, e.g. {"salience__gte": 0.8, "$or": [...]}
     */
    @Builder.Default
    private Map<String, Object> filters = new LinkedHashMap<>();

    /**
     * Similarity part; when absent the request is a plain filtered recall ordered by recency
     */
    private SimilarityRequest similarity;

    /**
     * Labels every returned node must carry besides the memory label
     */
    @Builder.Default
    private List<String> labels = new ArrayList<>();

    /**
     * 1-based page number (default: 1)
     */
    @Builder.Default
    private int page = 1;

    /**
     * Page size (default: 10)
     */
    @Builder.Default
    @JsonProperty("page_size")
    private int pageSize = 10;

    /**
     * Stamp last_accessed and bump access_count on the returned memories
     */
    @Builder.Default
    @JsonProperty("track_access")
    private boolean trackAccess = false;
}
