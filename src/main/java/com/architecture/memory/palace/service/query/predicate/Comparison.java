package com.architecture.memory.palace.service.query.predicate;

import java.util.List;
import java.util.Map;

/**
 * {@code target <op> $parameter}
 */
public record Comparison(String target, ComparisonOperator operator, String parameter) implements Predicate {

    @Override
    public String toCypher() {
        return target + " " + operator.symbol() + " $" + parameter;
    }

    @Override
    public List<String> parameterNames() {
        return List.of(parameter);
    }

    @Override
    public Predicate renameParameters(Map<String, String> renames) {
        return new Comparison(target, operator, Predicates.renamed(parameter, renames));
    }
}
