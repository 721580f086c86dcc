package com.architecture.memory.palace.service.query.filter;

import java.util.Optional;

/**
 * Operators accepted as {@code field__<suffix>} in a filter expression. A bare field is {@link #EQ}.
 */
public enum FilterOperator {
    EQ(null),
    NE("ne"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte"),
    IN("in"),
    OVERLAP("overlap"),
    CONTAINS("contains"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith");

    private final String suffix;

    FilterOperator(String suffix) {
        this.suffix = suffix;
    }

    public static Optional<FilterOperator> fromSuffix(String suffix) {
        for (FilterOperator operator : values()) {
            if (operator.suffix != null && operator.suffix.equals(suffix)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
