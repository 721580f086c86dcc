package com.architecture.memory.palace.service.query.pagination;

import com.architecture.memory.palace.service.query.CypherQueryBuilder;
import com.architecture.memory.palace.service.query.predicate.Comparison;
import com.architecture.memory.palace.service.query.predicate.ComparisonOperator;
import com.architecture.memory.palace.service.query.predicate.Predicate;
import com.architecture.memory.palace.service.query.predicate.Predicates;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordering and paging tail of a query. An ORDER BY is always emitted: paging over an
 * undefined order returns different rows for the same request.
 */
public final class Paginator {

    private Paginator() {
    }

    /**
     * {@code ORDER BY <keys> SKIP $p LIMIT $p}. SKIP is left out for the first page.
     *
     * @throws IllegalArgumentException if no sort key is given
     */
    public static CypherQueryBuilder apply(CypherQueryBuilder builder, List<SortKey> sortKeys, Pagination pagination) {
        requireKeys(sortKeys);
        builder.orderBy(sortKeys);
        if (pagination.skip() > 0) {
            builder.skip(pagination.skip());
        }
        return builder.limit(pagination.limit());
    }

    /**
     * {@code ORDER BY <keys> LIMIT $p} for keyset pages; the position comes from {@link #afterCursor}.
     */
    public static CypherQueryBuilder applyLimit(CypherQueryBuilder builder, List<SortKey> sortKeys, long limit) {
        requireKeys(sortKeys);
        return builder.orderBy(sortKeys).limit(limit);
    }

    /**
     * Predicate selecting rows strictly after the cursor in the given ordering:
     * {@code k1 < $a OR (k1 = $a AND k2 > $b) OR ...}, with {@code <} for descending keys
     * and {@code >} for ascending ones. Cursor values are bound to the builder's parameters.
     *
     * @throws IllegalArgumentException if the cursor and the sort keys differ in length
     */
    public static Predicate afterCursor(List<SortKey> sortKeys, PageCursor cursor, CypherQueryBuilder builder) {
        requireKeys(sortKeys);
        if (cursor.values().size() != sortKeys.size()) {
            throw new IllegalArgumentException(String.format(
                    "Cursor has %d values but the ordering has %d keys", cursor.values().size(), sortKeys.size()));
        }

        List<String> parameters = new ArrayList<>(sortKeys.size());
        for (Object value : cursor.values()) {
            parameters.add(builder.bind(value));
        }

        List<Predicate> alternatives = new ArrayList<>();
        for (int i = 0; i < sortKeys.size(); i++) {
            List<Predicate> terms = new ArrayList<>();
            for (int j = 0; j < i; j++) {
                terms.add(new Comparison(sortKeys.get(j).expression(), ComparisonOperator.EQ, parameters.get(j)));
            }
            SortKey key = sortKeys.get(i);
            ComparisonOperator after = key.direction() == SortDirection.DESC ? ComparisonOperator.LT : ComparisonOperator.GT;
            terms.add(new Comparison(key.expression(), after, parameters.get(i)));
            alternatives.add(Predicates.and(terms));
        }
        return Predicates.or(alternatives);
    }

    private static void requireKeys(List<SortKey> sortKeys) {
        if (sortKeys == null || sortKeys.isEmpty()) {
            throw new IllegalArgumentException("Pagination requires at least one sort key");
        }
    }
}
