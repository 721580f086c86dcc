package com.architecture.memory.palace.exception;

public class EmptyQueryException extends QueryBuildException {

    public EmptyQueryException() {
        super("Cannot build a query without any clauses");
    }
}
