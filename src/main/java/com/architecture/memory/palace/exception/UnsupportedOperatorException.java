package com.architecture.memory.palace.exception;

import lombok.Getter;

/**
 * A filter key used an operator suffix the compiler does not know, e.g. {@code salience__between}.
 */
@Getter
public class UnsupportedOperatorException extends FilterException {

    private final String field;
    private final String operator;

    public UnsupportedOperatorException(String field, String operator) {
        super(String.format("Unsupported filter operator '%s' on field '%s'", operator, field));
        this.field = field;
        this.operator = operator;
    }
}
