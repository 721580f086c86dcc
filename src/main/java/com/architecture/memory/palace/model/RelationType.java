package com.architecture.memory.palace.model;

/**
 * Relationship types between memory nodes. Only these may appear as relationship types
 * in generated queries.
 */
public enum RelationType {
    // Temporal
    FOLLOWS,
    PRECEDES,

    // Semantic
    ELABORATES,
    CONTRADICTS,
    REFERENCES,
    SUMMARIZES,

    // Emotional
    RESONATES_WITH,
    CONTRASTS_WITH,

    // Structural
    BELONGS_TO,
    CONTAINS,
    HAS_MEMORY,

    // Meta
    REMINDS_OF,
    LEARNED_FROM,
    RELATES_TO
}
