package com.architecture.memory.palace.service.query.predicate;

import java.util.List;
import java.util.Map;

/**
 * True when any element of the bound list also occurs in the list-valued target.
 * Asymmetric: the parameter is iterated, the target is searched.
 */
public record Overlap(String target, String parameter) implements Predicate {

    @Override
    public String toCypher() {
        return "ANY(item IN $" + parameter + " WHERE item IN " + target + ")";
    }

    @Override
    public List<String> parameterNames() {
        return List.of(parameter);
    }

    @Override
    public Predicate renameParameters(Map<String, String> renames) {
        return new Overlap(target, Predicates.renamed(parameter, renames));
    }
}
