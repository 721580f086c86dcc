package com.architecture.memory.palace.service.query.pagination;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordering-key values of the last row of the previous page, one per sort key and in the same order.
 */
public record PageCursor(List<Object> values) {

    public PageCursor {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("A cursor needs at least one ordering value");
        }
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Cursor values must not be null");
        }
        values = List.copyOf(values);
    }

    public static PageCursor of(Object... values) {
        return new PageCursor(Arrays.asList(values));
    }
}
