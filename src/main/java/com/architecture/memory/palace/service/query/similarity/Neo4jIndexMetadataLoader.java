package com.architecture.memory.palace.service.query.similarity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads vector index dimensionality from Neo4j once and hands it out as an immutable value,
 * so planners never look it up per query.
 */
@RequiredArgsConstructor
@Slf4j
public class Neo4jIndexMetadataLoader {

    static final String SHOW_VECTOR_INDEXES =
            "SHOW INDEXES YIELD name, type, options WHERE type = 'VECTOR' RETURN name, options";

    private static final String DIMENSIONS_KEY = "vector.dimensions";

    private final Driver neo4jDriver;

    public StaticIndexMetadataProvider load() {
        Map<String, Integer> dimensions = new HashMap<>();

        try (Session session = neo4jDriver.session()) {
            Result result = session.run(SHOW_VECTOR_INDEXES);
            while (result.hasNext()) {
                Record record = result.next();
                String name = record.get("name").asString();
                Integer size = readDimensions(record.get("options").asMap());
                if (size == null) {
                    log.warn("[Index Metadata] Vector index {} has no {} option, ignoring it", name, DIMENSIONS_KEY);
                    continue;
                }
                dimensions.put(name, size);
            }
        } catch (Neo4jException e) {
            log.error("[Index Metadata] Failed to read vector indexes: {}", e.getMessage(), e);
            throw e;
        }

        log.info("[Index Metadata] Discovered {} vector indexes: {}", dimensions.size(), dimensions);
        return new StaticIndexMetadataProvider(dimensions);
    }

    private static Integer readDimensions(Map<String, Object> options) {
        Object config = options.get("indexConfig");
        if (!(config instanceof Map<?, ?> indexConfig)) {
            return null;
        }
        Object value = indexConfig.get(DIMENSIONS_KEY);
        return value instanceof Number number ? number.intValue() : null;
    }
}
