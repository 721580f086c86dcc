package com.architecture.memory.palace.config;

import com.architecture.memory.palace.service.memory.MemoryQueryFactory;
import com.architecture.memory.palace.service.memory.Neo4jQueryExecutor;
import com.architecture.memory.palace.service.memory.QueryMetricsCollector;
import com.architecture.memory.palace.service.query.filter.FilterCompiler;
import com.architecture.memory.palace.service.query.filter.FilterExpressionReader;
import com.architecture.memory.palace.service.query.similarity.IndexMetadataProvider;
import com.architecture.memory.palace.service.query.similarity.Neo4jIndexMetadataLoader;
import com.architecture.memory.palace.service.query.similarity.SimilarityPlanner;
import com.architecture.memory.palace.service.query.similarity.StaticIndexMetadataProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Query engine wiring. Reads the memory.query.* properties from application.yml and passes
 * them explicitly to the planner, factory and executor.
 */
@Configuration
@Slf4j
public class QueryEngineConfig {

    @Value("${memory.query.index-name:memory_embeddings}")
    private String indexName;

    @Value("${memory.query.index-dimensions:0}")
    private int indexDimensions;

    @Value("${memory.query.discover-index:false}")
    private boolean discoverIndex;

    @Value("${memory.query.label:Memory}")
    private String label;

    @Value("${memory.query.alias:m}")
    private String alias;

    @Value("${memory.query.embedding-property:embedding}")
    private String embeddingProperty;

    @Value("${memory.query.timeout-seconds:30}")
    private int timeoutSeconds;

    @Bean
    public FilterCompiler filterCompiler() {
        return new FilterCompiler();
    }

    @Bean
    public FilterExpressionReader filterExpressionReader(ObjectMapper objectMapper) {
        return new FilterExpressionReader(objectMapper);
    }

    /**
     * Vector index dimensionality, read once at startup. Either discovered from Neo4j or taken
     * from memory.query.index-dimensions; with neither, the planner always scans.
     */
    @Bean
    public IndexMetadataProvider indexMetadataProvider(Driver neo4jDriver) {
        if (discoverIndex) {
            log.info("[Query Config] Discovering vector indexes from Neo4j");
            return new Neo4jIndexMetadataLoader(neo4jDriver).load();
        }
        if (indexDimensions > 0) {
            log.info("[Query Config] Using configured vector index {} with {} dimensions", indexName, indexDimensions);
            return StaticIndexMetadataProvider.of(indexName, indexDimensions);
        }
        log.warn("[Query Config] No vector index configured, similarity search will use exact scans");
        return StaticIndexMetadataProvider.empty();
    }

    @Bean
    public SimilarityPlanner similarityPlanner(IndexMetadataProvider indexMetadataProvider) {
        return new SimilarityPlanner(indexName, label, embeddingProperty, indexMetadataProvider);
    }

    @Bean
    public MemoryQueryFactory memoryQueryFactory(FilterCompiler filterCompiler, SimilarityPlanner similarityPlanner) {
        return new MemoryQueryFactory(filterCompiler, similarityPlanner, label, alias);
    }

    @Bean
    public QueryMetricsCollector queryMetricsCollector() {
        return new QueryMetricsCollector();
    }

    @Bean
    public Neo4jQueryExecutor neo4jQueryExecutor(Driver neo4jDriver, QueryMetricsCollector queryMetricsCollector) {
        log.info("[Query Config] Neo4j transaction timeout: {}s", timeoutSeconds);
        return new Neo4jQueryExecutor(neo4jDriver, Duration.ofSeconds(timeoutSeconds), queryMetricsCollector);
    }
}
