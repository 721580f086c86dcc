package com.architecture.memory.palace.service.query.predicate;

import java.util.List;
import java.util.Map;

public record NullCheck(String target, boolean negated) implements Predicate {

    @Override
    public String toCypher() {
        return target + (negated ? " IS NOT NULL" : " IS NULL");
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
