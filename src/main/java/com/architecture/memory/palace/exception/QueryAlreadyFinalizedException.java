package com.architecture.memory.palace.exception;

public class QueryAlreadyFinalizedException extends QueryBuildException {

    public QueryAlreadyFinalizedException() {
        super("Query builder has already been built; create a new builder for another query");
    }
}
