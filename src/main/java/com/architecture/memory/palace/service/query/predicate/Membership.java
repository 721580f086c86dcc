package com.architecture.memory.palace.service.query.predicate;

import java.util.List;
import java.util.Map;

/**
 * {@code target IN $parameter}, the parameter being a bound list.
 */
public record Membership(String target, String parameter) implements Predicate {

    @Override
    public String toCypher() {
        return target + " IN $" + parameter;
    }

    @Override
    public List<String> parameterNames() {
        return List.of(parameter);
    }

    @Override
    public Predicate renameParameters(Map<String, String> renames) {
        return new Membership(target, Predicates.renamed(parameter, renames));
    }
}
