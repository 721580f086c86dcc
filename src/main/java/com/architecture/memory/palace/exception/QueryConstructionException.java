package com.architecture.memory.palace.exception;

/**
 * Base type for every failure raised while compiling filters or building a query.
 * These are always raised before any database round-trip.
 */
public abstract class QueryConstructionException extends RuntimeException {

    protected QueryConstructionException(String message) {
        super(message);
    }
}
