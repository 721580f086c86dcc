package com.architecture.memory.palace.service.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for node and relationship patterns, e.g.
 * {@code (c:Conversation {id: $p0})-[:HAS_MEMORY]->(m:Memory)}.
 *
 * Labels, relationship types and property keys must be plain identifiers; property values
 * are bound to the owning query's parameter bag.
 */
public class PatternBuilder {

    public enum Direction {
        OUTGOING,
        INCOMING,
        BOTH
    }

    private final ParameterBag parameters;
    private final StringBuilder pattern = new StringBuilder();

    PatternBuilder(ParameterBag parameters) {
        this.parameters = parameters;
    }

    public PatternBuilder node(String variable) {
        return node(variable, List.of(), Map.of());
    }

    public PatternBuilder node(String variable, String label) {
        return node(variable, List.of(label), Map.of());
    }

    public PatternBuilder node(String variable, String label, Map<String, ?> properties) {
        return node(variable, List.of(label), properties);
    }

    /**
     * @param variable node variable, or an empty string for an anonymous node
     */
    public PatternBuilder node(String variable, List<String> labels, Map<String, ?> properties) {
        pattern.append('(');
        appendVariable(variable);
        for (String label : labels) {
            pattern.append(':').append(CypherFragments.requireIdentifier(label, "label"));
        }
        appendProperties(properties);
        pattern.append(')');
        return this;
    }

    public PatternBuilder relTo(String type) {
        return relationship("", List.of(type), Direction.OUTGOING, null, null, Map.of());
    }

    public PatternBuilder relFrom(String type) {
        return relationship("", List.of(type), Direction.INCOMING, null, null, Map.of());
    }

    public PatternBuilder rel(String type) {
        return relationship("", List.of(type), Direction.BOTH, null, null, Map.of());
    }

    /**
     * Adds a relationship pattern. Variable-length when either hop bound is given.
     *
     * @param types    allowed relationship types, joined with {@code |}; empty for any type
     * @param minHops  lower bound or null
     * @param maxHops  upper bound or null
     */
    public PatternBuilder relationship(String variable, List<String> types, Direction direction,
                                       Integer minHops, Integer maxHops, Map<String, ?> properties) {
        if (minHops != null && minHops < 0) {
            throw new IllegalArgumentException("minHops must be >= 0, got " + minHops);
        }
        if (minHops != null && maxHops != null && maxHops < minHops) {
            throw new IllegalArgumentException(String.format("maxHops %d is below minHops %d", maxHops, minHops));
        }

        pattern.append(direction == Direction.INCOMING ? "<-[" : "-[");
        appendVariable(variable);

        if (!types.isEmpty()) {
            List<String> checked = new ArrayList<>(types.size());
            for (String type : types) {
                checked.add(CypherFragments.requireIdentifier(type, "relationship type"));
            }
            pattern.append(':').append(String.join("|", checked));
        }

        if (minHops != null || maxHops != null) {
            pattern.append('*');
            if (minHops != null) {
                pattern.append(minHops);
            }
            pattern.append("..");
            if (maxHops != null) {
                pattern.append(maxHops);
            }
        }

        appendProperties(properties);
        pattern.append(direction == Direction.OUTGOING ? "]->" : "]-");
        return this;
    }

    public String build() {
        if (pattern.length() == 0) {
            throw new IllegalStateException("Pattern is empty");
        }
        return pattern.toString();
    }

    private void appendVariable(String variable) {
        if (variable != null && !variable.isEmpty()) {
            pattern.append(CypherFragments.requireIdentifier(variable, "variable"));
        }
    }

    private void appendProperties(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            return;
        }
        StringJoiner joiner = new StringJoiner(", ", " {", "}");
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            String key = CypherFragments.requireIdentifier(entry.getKey(), "property");
            joiner.add(key + ": " + parameters.placeholder(entry.getValue()));
        }
        pattern.append(joiner);
    }
}
