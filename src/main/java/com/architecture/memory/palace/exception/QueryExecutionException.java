package com.architecture.memory.palace.exception;

/**
 * Failure while handing a built query plan to the Neo4j driver.
 */
public class QueryExecutionException extends RuntimeException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
