package com.architecture.memory.palace.exception;

import lombok.Getter;

/**
 * The filter expression is structurally malformed: a group that is not a list,
 * a list operator given a scalar, an unsafe field name, and so on.
 */
@Getter
public class InvalidFilterShapeException extends FilterException {

    private final String key;
    private final String reason;

    public InvalidFilterShapeException(String key, String reason) {
        super(String.format("Invalid filter shape at '%s': %s", key, reason));
        this.key = key;
        this.reason = reason;
    }
}
