package com.architecture.memory.palace.service.query.similarity;

import com.architecture.memory.palace.service.query.pagination.SortKey;

import java.util.List;
import java.util.OptionalInt;

/**
 * What the planner emitted: the strategy, the beam width (index strategy only),
 * the variable holding the score and the ordering to apply after RETURN.
 */
public record SimilarityPlan(SimilarityStrategy strategy,
                             OptionalInt beamWidth,
                             String similarityVariable,
                             List<SortKey> sortKeys) {

    public SimilarityPlan {
        sortKeys = List.copyOf(sortKeys);
    }
}
