package com.architecture.memory.palace.service.query.clause;

/**
 * Cypher clause kinds the builder can emit, each mapped to the state it moves the query into.
 */
public enum ClauseKind {
    MATCH("MATCH", QueryState.RETRIEVAL),
    OPTIONAL_MATCH("OPTIONAL MATCH", QueryState.RETRIEVAL),
    CALL("CALL", QueryState.RETRIEVAL),
    UNWIND("UNWIND", QueryState.RETRIEVAL),
    WHERE("WHERE", QueryState.FILTERING),
    WITH("WITH", QueryState.PROJECTION),
    CREATE("CREATE", QueryState.MUTATION),
    MERGE("MERGE", QueryState.MUTATION),
    SET("SET", QueryState.MUTATION),
    REMOVE("REMOVE", QueryState.MUTATION),
    DELETE("DELETE", QueryState.MUTATION),
    DETACH_DELETE("DETACH DELETE", QueryState.MUTATION),
    RETURN("RETURN", QueryState.RETURN),
    ORDER_BY("ORDER BY", QueryState.ORDERING),
    SKIP("SKIP", QueryState.PAGING),
    LIMIT("LIMIT", QueryState.LIMITED);

    private final String keyword;
    private final QueryState state;

    ClauseKind(String keyword, QueryState state) {
        this.keyword = keyword;
        this.state = state;
    }

    public String keyword() {
        return keyword;
    }

    public QueryState state() {
        return state;
    }
}
