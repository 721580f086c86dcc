package com.architecture.memory.palace.service.query.predicate;

import com.architecture.memory.palace.service.query.CypherFragments;

import java.util.List;
import java.util.Map;

/**
 * {@code m:FriendUtterance}: the node carries every listed label. Used where the label cannot
 * sit in a MATCH pattern, e.g. on nodes yielded by a vector index call.
 */
public record LabelCheck(String variable, List<String> labels) implements Predicate {

    public LabelCheck {
        CypherFragments.requireIdentifier(variable, "variable");
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("LabelCheck needs at least one label");
        }
        labels.forEach(label -> CypherFragments.requireIdentifier(label, "label"));
        labels = List.copyOf(labels);
    }

    @Override
    public String toCypher() {
        return variable + ":" + String.join(":", labels);
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
