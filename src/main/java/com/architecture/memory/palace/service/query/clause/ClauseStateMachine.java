package com.architecture.memory.palace.service.query.clause;

import com.architecture.memory.palace.exception.InvalidClauseOrderException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.architecture.memory.palace.service.query.clause.QueryState.*;

/**
 * Transition table over {@link QueryState}. Holds no data besides the table itself;
 * every method is a pure function of its arguments.
 *
 * A WHERE closes the current retrieval stage: another MATCH/CALL/UNWIND needs a WITH first.
 * RETURN may only be followed by ORDER BY, SKIP and LIMIT, in that order.
 */
public final class ClauseStateMachine {

    private static final Map<QueryState, Set<QueryState>> ALLOWED = new EnumMap<>(QueryState.class);

    static {
        ALLOWED.put(INITIAL, EnumSet.of(RETRIEVAL, MUTATION));
        ALLOWED.put(RETRIEVAL, EnumSet.of(RETRIEVAL, FILTERING, PROJECTION, MUTATION, RETURN));
        ALLOWED.put(FILTERING, EnumSet.of(PROJECTION, MUTATION, RETURN));
        ALLOWED.put(PROJECTION, EnumSet.of(RETRIEVAL, FILTERING, PROJECTION, MUTATION, RETURN));
        ALLOWED.put(MUTATION, EnumSet.of(MUTATION, PROJECTION, RETURN, TERMINAL));
        ALLOWED.put(RETURN, EnumSet.of(ORDERING, PAGING, LIMITED, TERMINAL));
        ALLOWED.put(ORDERING, EnumSet.of(PAGING, LIMITED, TERMINAL));
        ALLOWED.put(PAGING, EnumSet.of(LIMITED, TERMINAL));
        ALLOWED.put(LIMITED, EnumSet.of(TERMINAL));
        ALLOWED.put(TERMINAL, EnumSet.noneOf(QueryState.class));
    }

    private ClauseStateMachine() {
    }

    public static boolean isAllowed(QueryState from, QueryState to) {
        return ALLOWED.get(from).contains(to);
    }

    public static Set<QueryState> allowedAfter(QueryState from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    /**
     * @return the state the query is in once {@code next} has been appended
     * @throws InvalidClauseOrderException if the clause may not follow {@code current}
     */
    public static QueryState transition(QueryState current, ClauseKind next) {
        return transition(current, next.state());
    }

    public static QueryState transition(QueryState current, QueryState next) {
        if (!isAllowed(current, next)) {
            throw new InvalidClauseOrderException(current, next);
        }
        return next;
    }

    /**
     * Validates that a query in {@code current} is complete and may be rendered.
     */
    public static QueryState finish(QueryState current) {
        return transition(current, TERMINAL);
    }
}
