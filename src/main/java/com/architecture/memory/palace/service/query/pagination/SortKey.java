package com.architecture.memory.palace.service.query.pagination;

import java.util.regex.Pattern;

/**
 * One ordering key: a variable ({@code similarity}) or property ({@code m.timestamp}) and a direction.
 */
public record SortKey(String expression, SortDirection direction) {

    private static final Pattern SORTABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    public SortKey {
        if (expression == null || !SORTABLE.matcher(expression).matches()) {
            throw new IllegalArgumentException("Sort key must be a variable or alias.property, got: " + expression);
        }
        if (direction == null) {
            throw new IllegalArgumentException("Sort direction is required for " + expression);
        }
    }

    public static SortKey asc(String expression) {
        return new SortKey(expression, SortDirection.ASC);
    }

    public static SortKey desc(String expression) {
        return new SortKey(expression, SortDirection.DESC);
    }

    public String toCypher() {
        return expression + " " + direction.name();
    }
}
