package com.architecture.memory.palace.service.query.similarity;

import com.architecture.memory.palace.exception.DimensionMismatchException;
import com.architecture.memory.palace.service.query.CypherQueryBuilder;
import com.architecture.memory.palace.service.query.QueryPlan;
import com.architecture.memory.palace.service.query.clause.QueryState;
import com.architecture.memory.palace.service.query.pagination.SortKey;
import com.architecture.memory.palace.service.query.predicate.Constant;
import com.architecture.memory.palace.service.query.predicate.Predicate;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimilarityPlannerTest {

    private static final String INDEX = "memory_embeddings";

    @Test
    void rejectsVectorOfWrongDimensionality_beforeEmittingAnything() {
        SimilarityPlanner planner = planner(StaticIndexMetadataProvider.of(INDEX, 1024));
        CypherQueryBuilder builder = new CypherQueryBuilder();
        SimilarityRequest request = SimilarityRequest.builder()
                .vector(new float[1536])
                .k(5)
                .threshold(0.7)
                .useIndex(true)
                .build();

        assertThatThrownBy(() -> planner.plan(request, Constant.TRUE, "m", 10, builder))
                .isInstanceOfSatisfying(DimensionMismatchException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(1024);
                    assertThat(e.getActual()).isEqualTo(1536);
                });
        assertThat(builder.state()).isEqualTo(QueryState.INITIAL);
    }

    @Test
    void rejectsWrongDimensionality_evenWhenScanning() {
        SimilarityPlanner planner = planner(StaticIndexMetadataProvider.of(INDEX, 3));
        SimilarityRequest request = request(new float[]{1f, 0f}, false);

        assertThatThrownBy(() -> planner.plan(request, Constant.TRUE, "m", 10, new CypherQueryBuilder()))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void floorsBeamWidthAtFifty() {
        assertThat(SimilarityPlanner.beamWidth(5, 10)).isEqualTo(50);
    }

    @Test
    void beamWidthNeverFallsBelowThreeTimesTheLimit() {
        for (long limit = 1; limit <= 500; limit++) {
            for (int k : new int[]{1, 10, 60, 200}) {
                int beam = SimilarityPlanner.beamWidth(k, limit);
                assertThat(beam).isGreaterThanOrEqualTo(50);
                assertThat((long) beam).isGreaterThanOrEqualTo(3 * limit);
                assertThat(beam).isGreaterThanOrEqualTo(k);
            }
        }
        assertThat(SimilarityPlanner.beamWidth(10, 40)).isEqualTo(120);
        assertThat(SimilarityPlanner.beamWidth(400, 40)).isEqualTo(400);
    }

    @Test
    void plansIndexLookupWithThresholdAndStructuralFilter() {
        SimilarityPlanner planner = planner(StaticIndexMetadataProvider.of(INDEX, 3));
        CypherQueryBuilder builder = new CypherQueryBuilder();
        Predicate structural = builder.compileFilter(Map.of("topic_id", 7), "m");
        float[] vector = {0.6f, 0.8f, 0f};

        SimilarityPlan plan = planner.plan(request(vector, true), structural, "m", 10, builder);
        QueryPlan query = builder.returns("m", "similarity").build();

        assertThat(plan.strategy()).isEqualTo(SimilarityStrategy.VECTOR_INDEX);
        assertThat(plan.beamWidth()).hasValue(50);
        assertThat(query.text()).isEqualTo(
                "CALL db.index.vector.queryNodes($p1, $p2, $p3) YIELD node AS m, score AS similarity"
                        + " WHERE (similarity > $p4 AND m.topic_id = $p0) RETURN m, similarity");
        assertThat(query.parameters())
                .containsEntry("p0", 7)
                .containsEntry("p1", INDEX)
                .containsEntry("p2", 50)
                .containsEntry("p3", vector)
                .containsEntry("p4", 0.7);
    }

    @Test
    void plansExactScanWhenIndexIsDisabled() {
        SimilarityPlanner planner = planner(StaticIndexMetadataProvider.of(INDEX, 2));
        CypherQueryBuilder builder = new CypherQueryBuilder();

        SimilarityPlan plan = planner.plan(request(new float[]{1f, 0f}, false), Constant.TRUE, "m", 10, builder);
        QueryPlan query = builder.returns("m", "similarity").build();

        assertThat(plan.strategy()).isEqualTo(SimilarityStrategy.EXACT_SCAN);
        assertThat(plan.beamWidth()).isEmpty();
        assertThat(query.text()).isEqualTo("MATCH (m:Memory)"
                + " WHERE (m.embedding IS NOT NULL AND size(m.embedding) = $p1)"
                + " WITH m, reduce(dot = 0.0, i IN range(0, size($p0) - 1) | dot + m.embedding[i] * $p0[i]) AS similarity"
                + " WHERE similarity > $p2 RETURN m, similarity");
        assertThat(query.parameters()).containsEntry("p1", 2).containsEntry("p2", 0.7);
    }

    @Test
    void fallsBackToExactScan_whenIndexIsUnknown() {
        SimilarityPlanner planner = planner(StaticIndexMetadataProvider.empty());
        CypherQueryBuilder builder = new CypherQueryBuilder();

        SimilarityPlan plan = planner.plan(request(new float[]{1f, 0f}, true), Constant.TRUE, "m", 10, builder);

        assertThat(plan.strategy()).isEqualTo(SimilarityStrategy.EXACT_SCAN);
        assertThat(builder.state()).isEqualTo(QueryState.FILTERING);
    }

    @Test
    void ordersBySimilarityThenRecencyThenId() {
        SimilarityPlanner planner = planner(StaticIndexMetadataProvider.of(INDEX, 2));

        SimilarityPlan bySimilarity = planner.plan(request(new float[]{1f, 0f}, true),
                Constant.TRUE, "m", 10, new CypherQueryBuilder());
        SimilarityRequest recencyOnly = request(new float[]{1f, 0f}, true);
        recencyOnly.setOrderBySimilarity(false);
        SimilarityPlan byRecency = planner.plan(recencyOnly, Constant.TRUE, "m", 10, new CypherQueryBuilder());

        assertThat(bySimilarity.sortKeys()).containsExactly(
                SortKey.desc("similarity"), SortKey.desc("m.timestamp"), SortKey.asc("m.id"));
        assertThat(byRecency.sortKeys()).containsExactly(SortKey.desc("m.timestamp"), SortKey.asc("m.id"));
    }

    @Test
    void validatesRequest() {
        SimilarityPlanner planner = planner(StaticIndexMetadataProvider.empty());

        assertThatThrownBy(() -> planner.plan(request(new float[0], true), Constant.TRUE, "m", 10,
                new CypherQueryBuilder())).isInstanceOf(IllegalArgumentException.class);

        SimilarityRequest zeroK = request(new float[]{1f}, true);
        zeroK.setK(0);
        assertThatThrownBy(() -> planner.plan(zeroK, Constant.TRUE, "m", 10, new CypherQueryBuilder()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.plan(request(new float[]{1f}, true), Constant.TRUE, "m", 0,
                new CypherQueryBuilder())).isInstanceOf(IllegalArgumentException.class);
    }

    private static SimilarityPlanner planner(IndexMetadataProvider metadata) {
        return new SimilarityPlanner(INDEX, "Memory", "embedding", metadata);
    }

    private static SimilarityRequest request(float[] vector, boolean useIndex) {
        return SimilarityRequest.builder()
                .vector(vector)
                .k(5)
                .threshold(0.7)
                .useIndex(useIndex)
                .build();
    }
}
