package com.architecture.memory.palace.exception;

import lombok.Getter;

/**
 * The query vector length differs from the dimensionality of the configured vector index.
 */
@Getter
public class DimensionMismatchException extends QueryBuildException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("Query vector has %d dimensions but the vector index expects %d", actual, expected));
        this.expected = expected;
        this.actual = actual;
    }
}
