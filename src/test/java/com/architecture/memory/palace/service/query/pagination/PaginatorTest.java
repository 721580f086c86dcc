package com.architecture.memory.palace.service.query.pagination;

import com.architecture.memory.palace.service.query.CypherQueryBuilder;
import com.architecture.memory.palace.service.query.QueryPlan;
import com.architecture.memory.palace.service.query.predicate.Predicate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginatorTest {

    private static final List<SortKey> RECENCY = List.of(SortKey.desc("m.timestamp"), SortKey.asc("m.id"));

    @Test
    void emitsOrderingThenSkipAndLimitAsParameters() {
        CypherQueryBuilder builder = recall();

        QueryPlan plan = Paginator.apply(builder, RECENCY, Pagination.ofPage(3, 25)).build();

        assertThat(plan.text()).endsWith("RETURN m ORDER BY m.timestamp DESC, m.id ASC SKIP $p0 LIMIT $p1");
        assertThat(plan.parameters()).containsExactly(Map.entry("p0", 50L), Map.entry("p1", 25L));
    }

    @Test
    void omitsSkipOnFirstPage() {
        QueryPlan plan = Paginator.apply(recall(), RECENCY, Pagination.first(10)).build();

        assertThat(plan.text()).isEqualTo("MATCH (m:Memory) RETURN m ORDER BY m.timestamp DESC, m.id ASC LIMIT $p0");
    }

    @Test
    void identicalRequestsProduceIdenticalPlans() {
        QueryPlan first = Paginator.apply(recall(), RECENCY, new Pagination(10, 10)).build();
        QueryPlan second = Paginator.apply(recall(), RECENCY, new Pagination(10, 10)).build();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void orderingIsMandatory() {
        assertThatThrownBy(() -> Paginator.apply(recall(), List.of(), Pagination.first(10)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Paginator.applyLimit(recall(), null, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buildsStrictlyAfterPredicateRespectingDirections() {
        CypherQueryBuilder builder = new CypherQueryBuilder().match(p -> p.node("m", "Memory"));

        Predicate after = Paginator.afterCursor(RECENCY, PageCursor.of(1700000000L, "mem-9"), builder);

        assertThat(after.toCypher()).isEqualTo("(m.timestamp < $p0 OR (m.timestamp = $p0 AND m.id > $p1))");

        QueryPlan plan = Paginator.applyLimit(builder.where(after).returns("m"), RECENCY, 10).build();
        assertThat(plan.text()).doesNotContain("SKIP");
        assertThat(plan.parameters()).containsEntry("p0", 1700000000L).containsEntry("p1", "mem-9");
    }

    @Test
    void rejectsCursorOfWrongLength() {
        CypherQueryBuilder builder = recall();

        assertThatThrownBy(() -> Paginator.afterCursor(RECENCY, PageCursor.of(1L), builder))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validatesPaginationValues() {
        assertThatThrownBy(() -> new Pagination(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Pagination(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Pagination.ofPage(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Pagination.ofPage(2, 10)).isEqualTo(new Pagination(10, 10));
        assertThat(new Pagination(10, 5).window()).isEqualTo(15);
    }

    @Test
    void rejectsUnsafeSortKeysAndNullCursorValues() {
        assertThatThrownBy(() -> SortKey.asc("m.id; DROP")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PageCursor.of("a", null)).isInstanceOf(IllegalArgumentException.class);
    }

    private static CypherQueryBuilder recall() {
        return new CypherQueryBuilder()
                .match(p -> p.node("m", "Memory"))
                .returns("m");
    }
}
