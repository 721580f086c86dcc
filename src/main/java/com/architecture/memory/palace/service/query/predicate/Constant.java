package com.architecture.memory.palace.service.query.predicate;

import java.util.List;
import java.util.Map;

/**
 * Boolean literal used as the identity of empty groups.
 */
public record Constant(boolean value) implements Predicate {

    public static final Constant TRUE = new Constant(true);
    public static final Constant FALSE = new Constant(false);

    @Override
    public String toCypher() {
        return value ? "true" : "false";
    }

    @Override
    public List<String> parameterNames() {
        return List.of();
    }

    @Override
    public Predicate renameParameters(Map<String, String> renames) {
        return this;
    }
}
