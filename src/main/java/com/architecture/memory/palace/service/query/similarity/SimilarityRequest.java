package com.architecture.memory.palace.service.query.similarity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Similarity part of a recall request.
 *
 * JSON shape:
 * <pre>
 * { "vector": [0.1, ...], "k": 10, "threshold": 0.7, "use_index": true, "order_by_similarity": true }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityRequest {

    /**
     * Query embedding, expected to be L2-normalized
     */
    private float[] vector;

    /**
     * Minimum number of nearest neighbours to ask the index for
     */
    @Builder.Default
    private int k = 10;

    /**
     * Candidates must score strictly above this value
     */
    @Builder.Default
    private double threshold = 0.7;

    @Builder.Default
    @JsonProperty("use_index")
    private boolean useIndex = true;

    @Builder.Default
    @JsonProperty("order_by_similarity")
    private boolean orderBySimilarity = true;
}
