package com.architecture.memory.palace.service.query.filter;

import com.architecture.memory.palace.exception.InvalidFilterShapeException;
import com.architecture.memory.palace.exception.UnsupportedOperatorException;
import com.architecture.memory.palace.service.query.CypherFragments;
import com.architecture.memory.palace.service.query.ParameterBag;
import com.architecture.memory.palace.service.query.predicate.BooleanOperator;
import com.architecture.memory.palace.service.query.predicate.Comparison;
import com.architecture.memory.palace.service.query.predicate.ComparisonOperator;
import com.architecture.memory.palace.service.query.predicate.Constant;
import com.architecture.memory.palace.service.query.predicate.Membership;
import com.architecture.memory.palace.service.query.predicate.NullCheck;
import com.architecture.memory.palace.service.query.predicate.Overlap;
import com.architecture.memory.palace.service.query.predicate.Predicate;
import com.architecture.memory.palace.service.query.predicate.Predicates;
import com.architecture.memory.palace.service.query.predicate.PrefixMatch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiles a declarative filter expression into a {@link Predicate} whose literals all live
 * in a {@link ParameterBag}.
 *
 * Expression format:
 * <pre>
 * {
 *   "salience__gte": 0.8,                       // field__operator
 *   "memory_type": "friend_utterance",          // bare field: equality
 *   "archived_at": null,                        // bare field with null: IS NULL
 *   "$or": [ {"topic_id": 3}, {"topic_id": 7} ] // boolean group over sub-expressions
 * }
 * </pre>
 * Sibling keys are AND-ed. Empty {@code $and} is TRUE, empty {@code $or} is FALSE.
 *
 * Stateless and safe to share.
 */
@Slf4j
public class FilterCompiler {

    public static final String AND_KEY = "$and";
    public static final String OR_KEY = "$or";

    private static final String OPERATOR_SEPARATOR = "__";

    /**
     * Compile onto a fresh bag.
     */
    public CompiledFilter compile(Map<String, ?> expression, String alias) {
        ParameterBag bag = new ParameterBag();
        Predicate predicate = compile(expression, alias, bag);
        return new CompiledFilter(predicate, bag);
    }

    /**
     * Compile onto an existing bag, so the predicate can be merged into a larger query.
     *
     * @param alias node variable the fields belong to, e.g. {@code m}
     */
    public Predicate compile(Map<String, ?> expression, String alias, ParameterBag bag) {
        CypherFragments.requireIdentifier(alias, "alias");
        if (expression == null || expression.isEmpty()) {
            return Constant.TRUE;
        }

        int before = bag.size();
        Predicate predicate = compileExpression(expression, alias, bag);
        log.debug("[Filter Compiler] Compiled {} top-level keys into {} new parameters",
                expression.size(), bag.size() - before);
        return predicate;
    }

    private Predicate compileExpression(Map<String, ?> expression, String alias, ParameterBag bag) {
        List<Predicate> parts = new ArrayList<>();
        for (Map.Entry<String, ?> entry : expression.entrySet()) {
            String key = entry.getKey();
            if (key == null) {
                throw new InvalidFilterShapeException("null", "filter keys must not be null");
            }
            if (key.startsWith("$")) {
                parts.add(compileGroup(key, entry.getValue(), alias, bag));
            } else {
                parts.add(compileField(key, entry.getValue(), alias, bag));
            }
        }
        return Predicates.and(parts);
    }

    private Predicate compileGroup(String key, Object value, String alias, ParameterBag bag) {
        BooleanOperator operator = switch (key) {
            case AND_KEY -> BooleanOperator.AND;
            case OR_KEY -> BooleanOperator.OR;
            default -> throw new InvalidFilterShapeException(key, "unknown group marker, expected $and or $or");
        };

        if (!(value instanceof List<?> items)) {
            throw new InvalidFilterShapeException(key, "expected a list of sub-expressions");
        }

        List<Predicate> children = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof Map<?, ?> map)) {
                throw new InvalidFilterShapeException(key + "[" + i + "]", "expected an object");
            }
            children.add(compileExpression(asExpression(key + "[" + i + "]", map), alias, bag));
        }

        return operator == BooleanOperator.AND ? Predicates.and(children) : Predicates.or(children);
    }

    private Predicate compileField(String key, Object value, String alias, ParameterBag bag) {
        String field = key;
        FilterOperator operator = FilterOperator.EQ;

        int separator = key.lastIndexOf(OPERATOR_SEPARATOR);
        if (separator >= 0) {
            field = key.substring(0, separator);
            String suffix = key.substring(separator + OPERATOR_SEPARATOR.length());
            final String fieldName = field;
            operator = FilterOperator.fromSuffix(suffix)
                    .orElseThrow(() -> new UnsupportedOperatorException(fieldName, suffix));
        }

        if (!CypherFragments.isIdentifier(field)) {
            throw new InvalidFilterShapeException(key, "field name must match [A-Za-z_][A-Za-z0-9_]*");
        }
        if (value instanceof Map<?, ?>) {
            throw new InvalidFilterShapeException(key, "objects are only allowed inside $and/$or");
        }

        String target = CypherFragments.property(alias, field);

        return switch (operator) {
            case EQ -> value == null
                    ? new NullCheck(target, false)
                    : comparison(key, target, ComparisonOperator.EQ, value, bag);
            case NE -> value == null
                    ? new NullCheck(target, true)
                    : comparison(key, target, ComparisonOperator.NE, value, bag);
            case LT -> comparison(key, target, ComparisonOperator.LT, requireScalar(key, value), bag);
            case LTE -> comparison(key, target, ComparisonOperator.LTE, requireScalar(key, value), bag);
            case GT -> comparison(key, target, ComparisonOperator.GT, requireScalar(key, value), bag);
            case GTE -> comparison(key, target, ComparisonOperator.GTE, requireScalar(key, value), bag);
            case CONTAINS -> comparison(key, target, ComparisonOperator.CONTAINS, requireText(key, value), bag);
            case ENDS_WITH -> comparison(key, target, ComparisonOperator.ENDS_WITH, requireText(key, value), bag);
            case STARTS_WITH -> {
                String prefix = requireText(key, value);
                String lengthParameter = bind(key, prefix.length(), bag);
                String valueParameter = bind(key, prefix, bag);
                yield new PrefixMatch(target, lengthParameter, valueParameter);
            }
            case IN -> new Membership(target, bind(key, requireList(key, value), bag));
            case OVERLAP -> new Overlap(target, bind(key, requireList(key, value), bag));
        };
    }

    private Predicate comparison(String key, String target, ComparisonOperator operator, Object value,
                                 ParameterBag bag) {
        return new Comparison(target, operator, bind(key, value, bag));
    }

    private String bind(String key, Object value, ParameterBag bag) {
        try {
            return bag.bind(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterShapeException(key, e.getMessage());
        }
    }

    private static Object requireScalar(String key, Object value) {
        if (value == null) {
            throw new InvalidFilterShapeException(key, "range operators cannot compare against null");
        }
        if (value instanceof Collection<?>) {
            throw new InvalidFilterShapeException(key, "range operators need a single value, not a list");
        }
        return value;
    }

    private static String requireText(String key, Object value) {
        if (!(value instanceof String text)) {
            throw new InvalidFilterShapeException(key, "text operators need a string value");
        }
        return text;
    }

    private static Collection<?> requireList(String key, Object value) {
        if (!(value instanceof Collection<?> list)) {
            throw new InvalidFilterShapeException(key, "list operators need a list value");
        }
        return list;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asExpression(String key, Map<?, ?> map) {
        for (Object mapKey : map.keySet()) {
            if (!(mapKey instanceof String)) {
                throw new InvalidFilterShapeException(key, "filter keys must be strings");
            }
        }
        return (Map<String, ?>) map;
    }
}
