package com.architecture.memory.palace.service.memory;

import com.architecture.memory.palace.dto.MemoryHit;
import com.architecture.memory.palace.dto.MemorySearchRequest;
import com.architecture.memory.palace.dto.MemorySearchResponse;
import com.architecture.memory.palace.model.MemoryFields;
import com.architecture.memory.palace.model.RelationType;
import com.architecture.memory.palace.service.query.QueryPlan;
import com.architecture.memory.palace.service.query.filter.FilterExpressionReader;
import com.architecture.memory.palace.service.query.pagination.Pagination;
import com.architecture.memory.palace.service.query.similarity.SimilarityPlanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Node;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Recall and maintenance operations on the memory graph: builds the query through
 * {@link MemoryQueryFactory} and runs it through {@link Neo4jQueryExecutor}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemorySearchService {

    private final MemoryQueryFactory queryFactory;
    private final Neo4jQueryExecutor executor;
    private final FilterExpressionReader filterReader;

    /**
     * Similarity recall when the request carries a vector, otherwise filtered recall by recency.
     */
    public MemorySearchResponse search(MemorySearchRequest request) {
        long startTime = System.currentTimeMillis();
        Pagination pagination = Pagination.ofPage(request.getPage(), request.getPageSize());
        boolean bySimilarity = request.getSimilarity() != null;

        log.info("[Memory Search] {} recall, page {} of size {}, {} filter keys",
                bySimilarity ? "Similarity" : "Filtered", request.getPage(), request.getPageSize(),
                request.getFilters() == null ? 0 : request.getFilters().size());

        QueryPlan plan = bySimilarity
                ? queryFactory.similaritySearch(request.getSimilarity(), request.getFilters(), pagination,
                        request.getLabels())
                : queryFactory.filteredRecall(request.getLabels(), request.getFilters(), pagination);

        List<MemoryHit> hits = executor.read(plan).stream()
                .map(this::toHit)
                .collect(Collectors.toList());

        if (request.isTrackAccess() && !hits.isEmpty()) {
            trackAccess(hits);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("[Memory Search] Recalled {} memories in {}ms", hits.size(), duration);

        return MemorySearchResponse.builder()
                .hits(hits)
                .resultCount(hits.size())
                .page(request.getPage())
                .pageSize(request.getPageSize())
                .processingTimeMs(duration)
                .build();
    }

    /**
     * Filtered recall with the filter given as a JSON document.
     */
    public MemorySearchResponse recall(String filterJson, List<String> labels, int page, int pageSize) {
        return search(MemorySearchRequest.builder()
                .filters(filterReader.read(filterJson))
                .labels(labels)
                .page(page)
                .pageSize(pageSize)
                .build());
    }

    public long count(List<String> labels, Map<String, Object> filters) {
        List<Record> records = executor.read(queryFactory.countMemories(labels, filters));
        return records.isEmpty() ? 0 : records.get(0).get(MemoryQueryFactory.COUNT_VARIABLE).asLong();
    }

    public Optional<MemoryHit> findById(String id) {
        return executor.read(queryFactory.findById(id)).stream()
                .findFirst()
                .map(this::toHit);
    }

    public MemoryHit remember(List<String> labels, String id, Map<String, Object> properties) {
        List<Record> records = executor.execute(queryFactory.upsertMemory(labels, id, properties));
        log.info("[Memory Search] Stored memory {}", id);
        return toHit(records.get(0));
    }

    public void forget(String id) {
        executor.execute(queryFactory.deleteById(id));
        log.info("[Memory Search] Deleted memory {}", id);
    }

    /**
     * @return false when either memory does not exist
     */
    public boolean connect(String sourceId, String targetId, RelationType type, Map<String, Object> properties) {
        boolean created = !executor.execute(queryFactory.connect(sourceId, targetId, type, properties)).isEmpty();
        if (!created) {
            log.warn("[Memory Search] Could not link {} -[{}]-> {}: memory not found", sourceId, type, targetId);
        }
        return created;
    }

    public void disconnect(String sourceId, String targetId, RelationType type) {
        executor.execute(queryFactory.disconnect(sourceId, targetId, type));
    }

    public List<MemoryHit> related(String id, List<RelationType> types, int depth, Pagination pagination) {
        return executor.read(queryFactory.relatedMemories(id, types, depth, pagination)).stream()
                .map(record -> toHit(record.get(0).asNode(), null))
                .collect(Collectors.toList());
    }

    /**
     * Creates the vector index unless one with this name already exists.
     *
     * @return true when the index was created
     */
    public boolean ensureVectorIndex(String indexName, String label, int dimensions) {
        if (!executor.read(queryFactory.checkVectorIndex(indexName)).isEmpty()) {
            log.info("[Memory Search] Vector index {} already exists", indexName);
            return false;
        }
        executor.execute(queryFactory.createVectorIndex(indexName, label, MemoryFields.EMBEDDING, dimensions));
        log.info("[Memory Search] Created vector index {} with {} dimensions", indexName, dimensions);
        return true;
    }

    private void trackAccess(List<MemoryHit> hits) {
        List<String> ids = hits.stream()
                .map(MemoryHit::getId)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (!ids.isEmpty()) {
            executor.execute(queryFactory.trackAccess(ids));
            log.debug("[Memory Search] Tracked access for {} memories", ids.size());
        }
    }

    private MemoryHit toHit(Record record) {
        Value similarity = record.containsKey(SimilarityPlanner.SIMILARITY_VARIABLE)
                ? record.get(SimilarityPlanner.SIMILARITY_VARIABLE)
                : null;
        return toHit(record.get(queryFactory.alias()).asNode(),
                similarity == null || similarity.isNull() ? null : similarity.asDouble());
    }

    private static MemoryHit toHit(Node node, Double similarity) {
        Map<String, Object> properties = new LinkedHashMap<>(node.asMap());
        properties.remove(MemoryFields.EMBEDDING);

        List<String> labels = new ArrayList<>();
        node.labels().forEach(labels::add);

        return MemoryHit.builder()
                .id(Objects.toString(properties.get(MemoryFields.ID), null))
                .content(Objects.toString(properties.get(MemoryFields.CONTENT), null))
                .labels(labels)
                .properties(properties)
                .similarity(similarity)
                .build();
    }
}
