package com.architecture.memory.palace.service.memory;

import com.architecture.memory.palace.model.MemoryFields;
import com.architecture.memory.palace.model.RelationType;
import com.architecture.memory.palace.service.query.CypherFragments;
import com.architecture.memory.palace.service.query.CypherQueryBuilder;
import com.architecture.memory.palace.service.query.ParameterBag;
import com.architecture.memory.palace.service.query.PatternBuilder.Direction;
import com.architecture.memory.palace.service.query.QueryPlan;
import com.architecture.memory.palace.service.query.filter.FilterCompiler;
import com.architecture.memory.palace.service.query.pagination.PageCursor;
import com.architecture.memory.palace.service.query.pagination.Pagination;
import com.architecture.memory.palace.service.query.pagination.Paginator;
import com.architecture.memory.palace.service.query.pagination.SortKey;
import com.architecture.memory.palace.service.query.predicate.Comparison;
import com.architecture.memory.palace.service.query.predicate.ComparisonOperator;
import com.architecture.memory.palace.service.query.predicate.Constant;
import com.architecture.memory.palace.service.query.predicate.LabelCheck;
import com.architecture.memory.palace.service.query.predicate.Membership;
import com.architecture.memory.palace.service.query.predicate.Predicate;
import com.architecture.memory.palace.service.query.predicate.Predicates;
import com.architecture.memory.palace.service.query.similarity.SimilarityPlan;
import com.architecture.memory.palace.service.query.similarity.SimilarityPlanner;
import com.architecture.memory.palace.service.query.similarity.SimilarityRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Catalogue of the queries the memory graph needs. Every query is assembled with a fresh
 * {@link CypherQueryBuilder}; the only hand-written text is the index DDL, whose options
 * Neo4j does not accept as parameters.
 */
@Slf4j
public class MemoryQueryFactory {

    public static final String COUNT_VARIABLE = "total";

    static final int MAX_RELATION_DEPTH = 5;

    private static final String SOURCE = "a";
    private static final String TARGET = "b";
    private static final String RELATIONSHIP = "r";
    private static final String RELATED = "related";

    private final FilterCompiler filterCompiler;
    private final SimilarityPlanner similarityPlanner;
    private final String label;
    private final String alias;

    public MemoryQueryFactory(FilterCompiler filterCompiler, SimilarityPlanner similarityPlanner,
                              String label, String alias) {
        this.filterCompiler = filterCompiler;
        this.similarityPlanner = similarityPlanner;
        this.label = CypherFragments.requireIdentifier(label, "label");
        this.alias = CypherFragments.requireIdentifier(alias, "alias");
    }

    public String alias() {
        return alias;
    }

    /**
     * Similarity recall: vector stage, structural filters, ordering by similarity and recency, paging.
     *
     * @param labels extra labels the candidates must carry, may be empty
     */
    public QueryPlan similaritySearch(SimilarityRequest request, Map<String, ?> filters,
                                      Pagination pagination, List<String> labels) {
        CypherQueryBuilder builder = newBuilder();
        Predicate structural = Predicates.and(labelCheck(labels), builder.compileFilter(filters, alias));

        SimilarityPlan plan = similarityPlanner.plan(request, structural, alias, pagination.window(), builder);
        builder.returns(alias, plan.similarityVariable());
        Paginator.apply(builder, plan.sortKeys(), pagination);
        return builder.build();
    }

    /**
     * Most recent memories matching the filters.
     */
    public QueryPlan filteredRecall(List<String> labels, Map<String, ?> filters, Pagination pagination) {
        CypherQueryBuilder builder = newBuilder()
                .match(p -> p.node(alias, nodeLabels(labels), Map.of()))
                .whereFilter(filters, alias)
                .returns(alias);
        Paginator.apply(builder, recencyOrder(alias), pagination);
        return builder.build();
    }

    /**
     * Keyset variant of {@link #filteredRecall}: the page after the row whose
     * {@code (timestamp, id)} is held by the cursor.
     */
    public QueryPlan filteredRecallAfter(List<String> labels, Map<String, ?> filters,
                                         PageCursor cursor, long limit) {
        List<SortKey> order = recencyOrder(alias);
        CypherQueryBuilder builder = newBuilder()
                .match(p -> p.node(alias, nodeLabels(labels), Map.of()));
        Predicate filter = builder.compileFilter(filters, alias);
        builder.where(Predicates.and(filter, Paginator.afterCursor(order, cursor, builder)))
                .returns(alias);
        Paginator.applyLimit(builder, order, limit);
        return builder.build();
    }

    public QueryPlan countMemories(List<String> labels, Map<String, ?> filters) {
        return newBuilder()
                .match(p -> p.node(alias, nodeLabels(labels), Map.of()))
                .whereFilter(filters, alias)
                .returns("count(" + alias + ") AS " + COUNT_VARIABLE)
                .build();
    }

    public QueryPlan findById(String id) {
        return newBuilder()
                .match(p -> p.node(alias, label, Map.of(MemoryFields.ID, id)))
                .returns(alias)
                .build();
    }

    /**
     * {@code MERGE (m:Memory:... {id: $p0}) SET m += $p1 RETURN m}
     */
    public QueryPlan upsertMemory(List<String> labels, String id, Map<String, ?> properties) {
        CypherQueryBuilder builder = newBuilder()
                .merge(p -> p.node(alias, nodeLabels(labels), Map.of(MemoryFields.ID, id)));
        if (properties != null && !properties.isEmpty()) {
            builder.setAll(alias, properties);
        }
        return builder.returns(alias).build();
    }

    public QueryPlan deleteById(String id) {
        return newBuilder()
                .match(p -> p.node(alias, label, Map.of(MemoryFields.ID, id)))
                .detachDelete(alias)
                .build();
    }

    /**
     * Creates the relationship once; later calls update its properties.
     */
    public QueryPlan connect(String sourceId, String targetId, RelationType type, Map<String, ?> properties) {
        CypherQueryBuilder builder = newBuilder()
                .match(p -> p.node(SOURCE, label, Map.of(MemoryFields.ID, sourceId)))
                .match(p -> p.node(TARGET, label, Map.of(MemoryFields.ID, targetId)))
                .merge(p -> p.node(SOURCE)
                        .relationship(RELATIONSHIP, List.of(type.name()), Direction.OUTGOING, null, null, Map.of())
                        .node(TARGET));
        if (properties != null && !properties.isEmpty()) {
            builder.setAll(RELATIONSHIP, properties);
        }
        return builder.returns(RELATIONSHIP).build();
    }

    public QueryPlan disconnect(String sourceId, String targetId, RelationType type) {
        return newBuilder()
                .match(p -> p.node(SOURCE, label, Map.of(MemoryFields.ID, sourceId))
                        .relationship(RELATIONSHIP, List.of(type.name()), Direction.OUTGOING, null, null, Map.of())
                        .node(TARGET, label, Map.of(MemoryFields.ID, targetId)))
                .delete(RELATIONSHIP)
                .build();
    }

    /**
     * Memories reachable from {@code id} within {@code depth} hops over the given relationship
     * types in either direction; any type when the list is empty.
     */
    public QueryPlan relatedMemories(String id, List<RelationType> types, int depth, Pagination pagination) {
        if (depth < 1 || depth > MAX_RELATION_DEPTH) {
            throw new IllegalArgumentException(String.format(
                    "Relation depth must be between 1 and %d, got %d", MAX_RELATION_DEPTH, depth));
        }
        List<String> typeNames = types == null ? List.of() : types.stream()
                .map(RelationType::name)
                .collect(Collectors.toList());

        CypherQueryBuilder builder = newBuilder()
                .match(p -> p.node(alias, label, Map.of(MemoryFields.ID, id))
                        .relationship("", typeNames, Direction.BOTH, 1, depth, Map.of())
                        .node(RELATED, label, Map.of()));
        builder.where(new Comparison(CypherFragments.property(RELATED, MemoryFields.ID),
                        ComparisonOperator.NE, builder.bind(id)))
                .with("DISTINCT " + RELATED)
                .returns(RELATED);
        Paginator.apply(builder, recencyOrder(RELATED), pagination);
        return builder.build();
    }

    /**
     * {@code MATCH (m:Memory) WHERE m.id IN $p0 SET m.last_accessed = datetime(),
     * m.access_count = coalesce(m.access_count, 0) + 1}
     */
    public QueryPlan trackAccess(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("Access tracking needs at least one memory id");
        }
        Map<String, String> updates = new LinkedHashMap<>();
        updates.put(MemoryFields.LAST_ACCESSED, "datetime()");
        updates.put(MemoryFields.ACCESS_COUNT,
                "coalesce(" + CypherFragments.property(alias, MemoryFields.ACCESS_COUNT) + ", 0) + 1");

        CypherQueryBuilder builder = newBuilder()
                .match(p -> p.node(alias, label, Map.of()));
        return builder.where(new Membership(CypherFragments.property(alias, MemoryFields.ID), builder.bind(ids)))
                .setComputed(alias, updates)
                .build();
    }

    // ========================= Vector index DDL =========================

    public QueryPlan checkVectorIndex(String indexName) {
        ParameterBag bag = new ParameterBag();
        String text = String.format(
                "SHOW INDEXES YIELD name, type, options WHERE name = %s AND type = %s RETURN name, options",
                bag.placeholder(indexName), bag.placeholder("VECTOR"));
        return new QueryPlan(text, bag.asMap());
    }

    public QueryPlan dropVectorIndex(String indexName) {
        return new QueryPlan(
                "DROP INDEX " + CypherFragments.requireIdentifier(indexName, "index name") + " IF EXISTS",
                Map.of());
    }

    /**
     * Cosine vector index on {@code label.property}.
     */
    public QueryPlan createVectorIndex(String indexName, String indexLabel, String property, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Vector index dimensions must be > 0, got " + dimensions);
        }
        String text = String.format(
                "CREATE VECTOR INDEX %s IF NOT EXISTS FOR (n:%s) ON (n.%s) "
                        + "OPTIONS {indexConfig: {`vector.dimensions`: %d, `vector.similarity_function`: 'cosine'}}",
                CypherFragments.requireIdentifier(indexName, "index name"),
                CypherFragments.requireIdentifier(indexLabel, "label"),
                CypherFragments.requireIdentifier(property, "property"),
                dimensions);
        log.info("[Memory Queries] Prepared vector index DDL for {} ({} dimensions)", indexName, dimensions);
        return new QueryPlan(text, Map.of());
    }

    private CypherQueryBuilder newBuilder() {
        return new CypherQueryBuilder(filterCompiler);
    }

    private List<String> nodeLabels(List<String> labels) {
        List<String> all = new ArrayList<>();
        all.add(label);
        if (labels != null) {
            labels.stream().filter(extra -> !extra.equals(label)).forEach(all::add);
        }
        return all;
    }

    private Predicate labelCheck(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return Constant.TRUE;
        }
        return new LabelCheck(alias, labels);
    }

    private static List<SortKey> recencyOrder(String variable) {
        return List.of(
                SortKey.desc(CypherFragments.property(variable, MemoryFields.TIMESTAMP)),
                SortKey.asc(CypherFragments.property(variable, MemoryFields.ID)));
    }
}
