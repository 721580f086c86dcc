package com.architecture.memory.palace.service.query.similarity;

import com.architecture.memory.palace.exception.DimensionMismatchException;
import com.architecture.memory.palace.model.MemoryFields;
import com.architecture.memory.palace.service.query.CypherFragments;
import com.architecture.memory.palace.service.query.CypherQueryBuilder;
import com.architecture.memory.palace.service.query.pagination.SortKey;
import com.architecture.memory.palace.service.query.predicate.Comparison;
import com.architecture.memory.palace.service.query.predicate.ComparisonOperator;
import com.architecture.memory.palace.service.query.predicate.NullCheck;
import com.architecture.memory.palace.service.query.predicate.Predicate;
import com.architecture.memory.palace.service.query.predicate.Predicates;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Plans the similarity stage of a recall query.
 *
 * With a usable vector index it emits
 * <pre>
 * CALL db.index.vector.queryNodes($index, $k, $vector) YIELD node AS m, score AS similarity
 * WHERE similarity > $threshold AND &lt;structural&gt;
 * </pre>
 * otherwise it scans every node of the configured label and computes the inner product in the query:
 * <pre>
 * MATCH (m:Memory) WHERE m.embedding IS NOT NULL AND size(m.embedding) = $dims AND &lt;structural&gt;
 * WITH m, reduce(...) AS similarity
 * WHERE similarity > $threshold
 * </pre>
 * Both variants leave the builder in a state where RETURN is allowed.
 */
@Slf4j
public class SimilarityPlanner {

    public static final String SIMILARITY_VARIABLE = "similarity";

    static final String VECTOR_QUERY_PROCEDURE = "db.index.vector.queryNodes";
    static final int MIN_BEAM_WIDTH = 50;
    static final int BEAM_MULTIPLIER = 3;

    private final String indexName;
    private final String label;
    private final String vectorProperty;
    private final IndexMetadataProvider indexMetadata;

    public SimilarityPlanner(String indexName, String label, String vectorProperty,
                             IndexMetadataProvider indexMetadata) {
        this.indexName = CypherFragments.requireIdentifier(indexName, "index name");
        this.label = CypherFragments.requireIdentifier(label, "label");
        this.vectorProperty = CypherFragments.requireIdentifier(vectorProperty, "property");
        this.indexMetadata = indexMetadata;
    }

    /**
     * Beam width asked from the index: wide enough that threshold and structural filtering
     * still leave {@code requestedLimit} rows.
     */
    public static int beamWidth(int k, long requestedLimit) {
        long widened = Math.max(Math.max(k, BEAM_MULTIPLIER * requestedLimit), MIN_BEAM_WIDTH);
        return (int) Math.min(widened, Integer.MAX_VALUE);
    }

    /**
     * Emits the similarity clauses into {@code builder}.
     *
     * @param structural     compiled structural filter, {@code Constant.TRUE} for none
     * @param alias          variable the candidate nodes are bound to
     * @param requestedLimit rows the caller will page over (skip + limit)
     * @throws DimensionMismatchException if the index dimensionality is known and differs from the vector length
     */
    public SimilarityPlan plan(SimilarityRequest request, Predicate structural, String alias,
                               long requestedLimit, CypherQueryBuilder builder) {
        validate(request, requestedLimit);
        CypherFragments.requireIdentifier(alias, "alias");

        float[] vector = request.getVector();
        OptionalInt indexDimensions = indexMetadata.dimensionsFor(indexName);
        if (indexDimensions.isPresent() && indexDimensions.getAsInt() != vector.length) {
            log.warn("[Similarity Planner] Rejecting {}-dimensional vector for index {} ({} dimensions)",
                    vector.length, indexName, indexDimensions.getAsInt());
            throw new DimensionMismatchException(indexDimensions.getAsInt(), vector.length);
        }

        SimilarityPlan plan;
        if (request.isUseIndex() && indexDimensions.isPresent()) {
            plan = planIndexLookup(request, structural, alias, requestedLimit, builder);
        } else {
            if (request.isUseIndex()) {
                log.warn("[Similarity Planner] Vector index {} is not available, falling back to exact scan", indexName);
            }
            plan = planExactScan(request, structural, alias, builder);
        }

        log.info("[Similarity Planner] Planned {} similarity stage (k={}, beam={}, threshold={})",
                plan.strategy(), request.getK(),
                plan.beamWidth().isPresent() ? plan.beamWidth().getAsInt() : "n/a",
                request.getThreshold());
        return plan;
    }

    private SimilarityPlan planIndexLookup(SimilarityRequest request, Predicate structural, String alias,
                                           long requestedLimit, CypherQueryBuilder builder) {
        int beam = beamWidth(request.getK(), requestedLimit);

        builder.call(VECTOR_QUERY_PROCEDURE, List.of(indexName, beam, request.getVector()),
                "node AS " + alias, "score AS " + SIMILARITY_VARIABLE);

        Predicate aboveThreshold = new Comparison(SIMILARITY_VARIABLE, ComparisonOperator.GT,
                builder.bind(request.getThreshold()));
        builder.where(Predicates.and(aboveThreshold, structural));

        return new SimilarityPlan(SimilarityStrategy.VECTOR_INDEX, OptionalInt.of(beam), SIMILARITY_VARIABLE,
                sortKeys(request, alias));
    }

    private SimilarityPlan planExactScan(SimilarityRequest request, Predicate structural, String alias,
                                         CypherQueryBuilder builder) {
        String stored = CypherFragments.property(alias, vectorProperty);

        builder.match(pattern -> pattern.node(alias, label));
        String vectorParameter = builder.bind(request.getVector());
        Predicate comparable = Predicates.and(
                new NullCheck(stored, true),
                new Comparison("size(" + stored + ")", ComparisonOperator.EQ, builder.bind(request.getVector().length)),
                structural);
        builder.where(comparable);
        builder.withInnerProduct(alias, vectorProperty, vectorParameter, SIMILARITY_VARIABLE);
        builder.where(new Comparison(SIMILARITY_VARIABLE, ComparisonOperator.GT, builder.bind(request.getThreshold())));

        return new SimilarityPlan(SimilarityStrategy.EXACT_SCAN, OptionalInt.empty(), SIMILARITY_VARIABLE,
                sortKeys(request, alias));
    }

    private static List<SortKey> sortKeys(SimilarityRequest request, String alias) {
        List<SortKey> keys = new ArrayList<>();
        if (request.isOrderBySimilarity()) {
            keys.add(SortKey.desc(SIMILARITY_VARIABLE));
        }
        keys.add(SortKey.desc(CypherFragments.property(alias, MemoryFields.TIMESTAMP)));
        keys.add(SortKey.asc(CypherFragments.property(alias, MemoryFields.ID)));
        return keys;
    }

    private static void validate(SimilarityRequest request, long requestedLimit) {
        if (request == null || request.getVector() == null || request.getVector().length == 0) {
            throw new IllegalArgumentException("Similarity request needs a non-empty vector");
        }
        if (request.getK() < 1) {
            throw new IllegalArgumentException("k must be >= 1, got " + request.getK());
        }
        if (requestedLimit < 1) {
            throw new IllegalArgumentException("Requested limit must be >= 1, got " + requestedLimit);
        }
    }
}
