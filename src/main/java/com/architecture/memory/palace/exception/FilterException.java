package com.architecture.memory.palace.exception;

/**
 * Raised when a filter expression cannot be compiled into a predicate.
 */
public abstract class FilterException extends QueryConstructionException {

    protected FilterException(String message) {
        super(message);
    }
}
