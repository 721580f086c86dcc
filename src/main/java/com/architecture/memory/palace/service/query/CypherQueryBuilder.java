package com.architecture.memory.palace.service.query;

import com.architecture.memory.palace.exception.EmptyQueryException;
import com.architecture.memory.palace.exception.QueryAlreadyFinalizedException;
import com.architecture.memory.palace.service.query.clause.ClauseKind;
import com.architecture.memory.palace.service.query.clause.ClauseStateMachine;
import com.architecture.memory.palace.service.query.clause.QueryState;
import com.architecture.memory.palace.service.query.filter.CompiledFilter;
import com.architecture.memory.palace.service.query.filter.FilterCompiler;
import com.architecture.memory.palace.service.query.pagination.SortKey;
import com.architecture.memory.palace.service.query.predicate.Predicate;
import com.architecture.memory.palace.service.query.predicate.Predicates;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Fluent Cypher builder. Every clause is checked against {@link ClauseStateMachine} before it
 * is appended, and every literal goes through the builder's {@link ParameterBag}.
 *
 * <pre>
 * QueryPlan plan = new CypherQueryBuilder()
 *         .match(p -> p.node("m", "Memory"))
 *         .whereFilter(Map.of("salience__gte", 0.8), "m")
 *         .returns("m")
 *         .orderBy(SortKey.desc("m.timestamp"), SortKey.asc("m.id"))
 *         .limit(10)
 *         .build();
 * </pre>
 *
 * One builder per query; instances are not thread-safe and cannot be reused after {@link #build()}.
 */
@Slf4j
public class CypherQueryBuilder {

    private final ParameterBag parameters;
    private final FilterCompiler filterCompiler;
    private final List<String> clauses = new ArrayList<>();

    private QueryState state = QueryState.INITIAL;
    private boolean finalized;

    public CypherQueryBuilder() {
        this(new ParameterBag(), new FilterCompiler());
    }

    public CypherQueryBuilder(FilterCompiler filterCompiler) {
        this(new ParameterBag(), filterCompiler);
    }

    public CypherQueryBuilder(ParameterBag parameters, FilterCompiler filterCompiler) {
        this.parameters = parameters;
        this.filterCompiler = filterCompiler;
    }

    public QueryState state() {
        return state;
    }

    /**
     * Bind a literal to this query's bag and return the parameter name.
     */
    public String bind(Object value) {
        ensureOpen();
        return parameters.bind(value);
    }

    /**
     * Compile a filter expression against this query's bag without emitting a clause,
     * so the predicate can be combined with others first.
     */
    public Predicate compileFilter(Map<String, ?> expression, String alias) {
        ensureOpen();
        return filterCompiler.compile(expression, alias, parameters);
    }

    // ========================= Retrieval =========================

    public CypherQueryBuilder match(UnaryOperator<PatternBuilder> pattern) {
        return append(ClauseKind.MATCH, () -> pattern.apply(new PatternBuilder(parameters)).build());
    }

    public CypherQueryBuilder optionalMatch(UnaryOperator<PatternBuilder> pattern) {
        return append(ClauseKind.OPTIONAL_MATCH, () -> pattern.apply(new PatternBuilder(parameters)).build());
    }

    /**
     * {@code CALL procedure($a, $b) YIELD ...}; every argument is bound as a parameter.
     */
    public CypherQueryBuilder call(String procedure, List<?> arguments, String... yieldItems) {
        CypherFragments.requireProcedure(procedure);
        List<String> yields = templates(yieldItems);
        return append(ClauseKind.CALL, () -> {
            String args = arguments.stream()
                    .map(parameters::placeholder)
                    .collect(Collectors.joining(", ", "(", ")"));
            return yields.isEmpty()
                    ? procedure + args
                    : procedure + args + " YIELD " + String.join(", ", yields);
        });
    }

    public CypherQueryBuilder unwind(Collection<?> values, String alias) {
        CypherFragments.requireIdentifier(alias, "alias");
        return append(ClauseKind.UNWIND, () -> parameters.placeholder(values) + " AS " + alias);
    }

    // ========================= Filtering =========================

    /**
     * Adds a WHERE clause. A predicate that is constant TRUE is validated but not rendered.
     * The predicate must have been built on this query's bag ({@link #bind}, {@link #compileFilter});
     * a filter compiled on its own bag goes through {@link #where(CompiledFilter)}.
     *
     * @throws IllegalArgumentException if the predicate references parameters this query does not own
     */
    public CypherQueryBuilder where(Predicate predicate) {
        return appendWhere(() -> predicate);
    }

    /**
     * Adds a WHERE clause for a filter compiled on its own bag. Its values are re-bound into this
     * query and the predicate is rewritten to the new names, so a {@code $p0} of the filter never
     * resolves to a value bound here earlier.
     */
    public CypherQueryBuilder where(CompiledFilter filter) {
        return appendWhere(() -> {
            if (Predicates.isTrue(filter.predicate())) {
                return filter.predicate();
            }
            Map<String, String> renames = parameters.merge(filter.parameters());
            return filter.predicate().renameParameters(renames);
        });
    }

    public CypherQueryBuilder whereFilter(Map<String, ?> expression, String alias) {
        return appendWhere(() -> filterCompiler.compile(expression, alias, parameters));
    }

    // ========================= Projection =========================

    public CypherQueryBuilder with(String... items) {
        List<String> checked = requireItems(items);
        return append(ClauseKind.WITH, () -> String.join(", ", checked));
    }

    /**
     * {@code WITH alias, <inner product of alias.vectorProperty and $vector> AS as}.
     * Stored and query vectors are expected to be normalized, so this is cosine similarity.
     *
     * @param vectorParameter name of a vector already bound to this query
     */
    public CypherQueryBuilder withInnerProduct(String alias, String vectorProperty, String vectorParameter, String as) {
        String stored = CypherFragments.property(alias, vectorProperty);
        CypherFragments.requireIdentifier(as, "variable");
        requireOwned(vectorParameter);
        String expression = String.format(
                "reduce(dot = 0.0, i IN range(0, size($%1$s) - 1) | dot + %2$s[i] * $%1$s[i]) AS %3$s",
                vectorParameter, stored, as);
        return append(ClauseKind.WITH, () -> alias + ", " + expression);
    }

    public CypherQueryBuilder returns(String... items) {
        List<String> checked = requireItems(items);
        return append(ClauseKind.RETURN, () -> String.join(", ", checked));
    }

    // ========================= Ordering and paging =========================

    public CypherQueryBuilder orderBy(SortKey... keys) {
        return orderBy(Arrays.asList(keys));
    }

    public CypherQueryBuilder orderBy(List<SortKey> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("ORDER BY needs at least one sort key");
        }
        return append(ClauseKind.ORDER_BY, () -> keys.stream()
                .map(SortKey::toCypher)
                .collect(Collectors.joining(", ")));
    }

    public CypherQueryBuilder skip(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("SKIP must be >= 0, got " + count);
        }
        return append(ClauseKind.SKIP, () -> parameters.placeholder(count));
    }

    public CypherQueryBuilder limit(long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("LIMIT must be > 0, got " + count);
        }
        return append(ClauseKind.LIMIT, () -> parameters.placeholder(count));
    }

    // ========================= Mutation =========================

    public CypherQueryBuilder create(UnaryOperator<PatternBuilder> pattern) {
        return append(ClauseKind.CREATE, () -> pattern.apply(new PatternBuilder(parameters)).build());
    }

    public CypherQueryBuilder merge(UnaryOperator<PatternBuilder> pattern) {
        return append(ClauseKind.MERGE, () -> pattern.apply(new PatternBuilder(parameters)).build());
    }

    /**
     * {@code SET m.a = $p0, m.b = $p1}
     */
    public CypherQueryBuilder set(String alias, Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            throw new IllegalArgumentException("SET needs at least one property");
        }
        properties.keySet().forEach(key -> CypherFragments.property(alias, key));
        return append(ClauseKind.SET, () -> {
            StringJoiner joiner = new StringJoiner(", ");
            properties.forEach((key, value) ->
                    joiner.add(CypherFragments.property(alias, key) + " = " + parameters.placeholder(value)));
            return joiner.toString();
        });
    }

    /**
     * {@code SET m.a = datetime(), m.b = coalesce(m.b, 0) + 1}: values are Cypher expressions
     * that carry no literals.
     */
    public CypherQueryBuilder setComputed(String alias, Map<String, String> expressions) {
        if (expressions == null || expressions.isEmpty()) {
            throw new IllegalArgumentException("SET needs at least one property");
        }
        StringJoiner joiner = new StringJoiner(", ");
        expressions.forEach((key, expression) -> joiner.add(
                CypherFragments.property(alias, key) + " = " + CypherFragments.requireTemplate(expression)));
        return append(ClauseKind.SET, joiner::toString);
    }

    /**
     * {@code SET m += $p0}
     */
    public CypherQueryBuilder setAll(String alias, Map<String, ?> properties) {
        CypherFragments.requireIdentifier(alias, "alias");
        properties.keySet().forEach(key -> CypherFragments.requireIdentifier(key, "property"));
        return append(ClauseKind.SET, () -> alias + " += " + parameters.placeholder(properties));
    }

    public CypherQueryBuilder remove(String alias, String... properties) {
        if (properties.length == 0) {
            throw new IllegalArgumentException("REMOVE needs at least one property");
        }
        List<String> targets = Arrays.stream(properties)
                .map(property -> CypherFragments.property(alias, property))
                .collect(Collectors.toList());
        return append(ClauseKind.REMOVE, () -> String.join(", ", targets));
    }

    public CypherQueryBuilder delete(String... variables) {
        List<String> targets = identifiers(variables);
        return append(ClauseKind.DELETE, () -> String.join(", ", targets));
    }

    public CypherQueryBuilder detachDelete(String... variables) {
        List<String> targets = identifiers(variables);
        return append(ClauseKind.DETACH_DELETE, () -> String.join(", ", targets));
    }

    // ========================= Build =========================

    /**
     * Renders the clauses into a {@link QueryPlan}. Terminal: the builder rejects any call afterwards.
     *
     * @throws EmptyQueryException                 if no clause was added
     * @throws QueryAlreadyFinalizedException      if called twice
     * @throws com.architecture.memory.palace.exception.InvalidClauseOrderException
     *         if the query does not end in RETURN, ORDER BY, SKIP, LIMIT or a write clause
     */
    public QueryPlan build() {
        ensureOpen();
        if (clauses.isEmpty()) {
            throw new EmptyQueryException();
        }
        state = ClauseStateMachine.finish(state);
        finalized = true;

        QueryPlan plan = new QueryPlan(String.join(" ", clauses), parameters.asMap());
        log.debug("[Query Builder] Built query with {} clauses and {} parameters: {}",
                clauses.size(), parameters.size(), plan.text());
        return plan;
    }

    private CypherQueryBuilder appendWhere(Supplier<Predicate> predicateSupplier) {
        ensureOpen();
        QueryState next = ClauseStateMachine.transition(state, ClauseKind.WHERE);
        int mark = parameters.size();
        Predicate predicate;
        try {
            predicate = predicateSupplier.get();
            predicate.parameterNames().forEach(this::requireOwned);
        } catch (RuntimeException e) {
            parameters.rollback(mark);
            throw e;
        }
        if (Predicates.isTrue(predicate)) {
            log.debug("[Query Builder] Skipping WHERE for a predicate that is always true");
            return this;
        }
        clauses.add(ClauseKind.WHERE.keyword() + " " + predicate.toCypher());
        state = next;
        return this;
    }

    private CypherQueryBuilder append(ClauseKind kind, Supplier<String> body) {
        ensureOpen();
        QueryState next = ClauseStateMachine.transition(state, kind);
        int mark = parameters.size();
        String rendered;
        try {
            rendered = body.get();
        } catch (RuntimeException e) {
            parameters.rollback(mark);
            throw e;
        }
        clauses.add(kind.keyword() + " " + rendered);
        state = next;
        return this;
    }

    private void ensureOpen() {
        if (finalized) {
            throw new QueryAlreadyFinalizedException();
        }
    }

    private void requireOwned(String parameterName) {
        if (!parameters.contains(parameterName)) {
            throw new IllegalArgumentException("Parameter $" + parameterName + " is not bound to this query");
        }
    }

    private static List<String> requireItems(String... items) {
        if (items.length == 0) {
            throw new IllegalArgumentException("At least one projection item is required");
        }
        return templates(items);
    }

    private static List<String> templates(String... items) {
        return Arrays.stream(items)
                .map(CypherFragments::requireTemplate)
                .collect(Collectors.toList());
    }

    private static List<String> identifiers(String... variables) {
        if (variables.length == 0) {
            throw new IllegalArgumentException("At least one variable is required");
        }
        return Arrays.stream(variables)
                .map(variable -> CypherFragments.requireIdentifier(variable, "variable"))
                .collect(Collectors.toList());
    }
}
