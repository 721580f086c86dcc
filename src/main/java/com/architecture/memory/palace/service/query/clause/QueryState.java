package com.architecture.memory.palace.service.query.clause;

/**
 * States of a query under construction.
 *
 * PAGING follows SKIP and LIMITED follows LIMIT, so a SKIP can never be emitted after a LIMIT.
 * TERMINAL is reached only through {@code build()}.
 */
public enum QueryState {
    INITIAL,
    RETRIEVAL,
    FILTERING,
    PROJECTION,
    MUTATION,
    RETURN,
    ORDERING,
    PAGING,
    LIMITED,
    TERMINAL
}
