package com.architecture.memory.palace.exception;

/**
 * Raised when a query cannot be assembled or rendered.
 */
public abstract class QueryBuildException extends QueryConstructionException {

    protected QueryBuildException(String message) {
        super(message);
    }
}
