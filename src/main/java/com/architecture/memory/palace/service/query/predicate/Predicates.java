package com.architecture.memory.palace.service.query.predicate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Combinators that keep the boolean algebra of constants: TRUE is dropped from AND and
 * FALSE absorbs it; FALSE is dropped from OR and TRUE absorbs it. Nested groups of the same
 * operator are flattened.
 */
public final class Predicates {

    private Predicates() {
    }

    public static Predicate and(Predicate... predicates) {
        return combine(BooleanOperator.AND, Arrays.asList(predicates));
    }

    public static Predicate and(List<Predicate> predicates) {
        return combine(BooleanOperator.AND, predicates);
    }

    public static Predicate or(Predicate... predicates) {
        return combine(BooleanOperator.OR, Arrays.asList(predicates));
    }

    public static Predicate or(List<Predicate> predicates) {
        return combine(BooleanOperator.OR, predicates);
    }

    public static boolean isTrue(Predicate predicate) {
        return Constant.TRUE.equals(predicate);
    }

    static String renamed(String parameter, Map<String, String> renames) {
        String target = renames.get(parameter);
        if (target == null) {
            throw new IllegalArgumentException("No replacement for parameter $" + parameter);
        }
        return target;
    }

    static Predicate combine(BooleanOperator operator, List<Predicate> predicates) {
        List<Predicate> kept = new ArrayList<>();
        for (Predicate predicate : predicates) {
            if (predicate == null || predicate.equals(operator.identity())) {
                continue;
            }
            if (predicate.equals(operator.absorbing())) {
                return operator.absorbing();
            }
            if (predicate instanceof Group group && group.operator() == operator) {
                kept.addAll(group.children());
            } else {
                kept.add(predicate);
            }
        }
        if (kept.isEmpty()) {
            return operator.identity();
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return new Group(operator, kept);
    }
}
