package com.architecture.memory.palace.service.query.similarity;

public enum SimilarityStrategy {
    /**
     * Approximate nearest neighbours through {@code db.index.vector.queryNodes}
     */
    VECTOR_INDEX,
    /**
     * Exact inner product computed in the query over every candidate
     */
    EXACT_SCAN
}
