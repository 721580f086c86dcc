package com.architecture.memory.palace.service.query.predicate;

import java.util.List;
import java.util.Map;

/**
 * Length-bounded prefix match: {@code left(target, $length) = $value}.
 */
public record PrefixMatch(String target, String lengthParameter, String valueParameter) implements Predicate {

    @Override
    public String toCypher() {
        return "left(" + target + ", $" + lengthParameter + ") = $" + valueParameter;
    }

    @Override
    public List<String> parameterNames() {
        return List.of(lengthParameter, valueParameter);
    }

    @Override
    public Predicate renameParameters(Map<String, String> renames) {
        return new PrefixMatch(target, Predicates.renamed(lengthParameter, renames),
                Predicates.renamed(valueParameter, renames));
    }
}
