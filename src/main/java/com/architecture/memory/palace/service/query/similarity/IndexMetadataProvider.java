package com.architecture.memory.palace.service.query.similarity;

import java.util.OptionalInt;

/**
 * Source of vector index dimensionality. Empty means the index does not exist.
 */
public interface IndexMetadataProvider {

    OptionalInt dimensionsFor(String indexName);
}
