package com.architecture.memory.palace.exception;

import com.architecture.memory.palace.service.query.clause.QueryState;
import lombok.Getter;

/**
 * A clause was emitted in a position the clause state machine does not allow.
 */
@Getter
public class InvalidClauseOrderException extends QueryBuildException {

    private final QueryState from;
    private final QueryState attempted;

    public InvalidClauseOrderException(QueryState from, QueryState attempted) {
        super(String.format("Cannot move from %s to %s; insert a WITH projection to re-open retrieval",
                from, attempted));
        this.from = from;
        this.attempted = attempted;
    }
}
