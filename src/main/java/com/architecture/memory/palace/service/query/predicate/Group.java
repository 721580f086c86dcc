package com.architecture.memory.palace.service.query.predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AND/OR over two or more children. Use {@link Predicates} to build groups so that
 * constants and single children are folded away.
 */
public record Group(BooleanOperator operator, List<Predicate> children) implements Predicate {

    public Group {
        if (children.size() < 2) {
            throw new IllegalArgumentException("A group needs at least two children, got " + children.size());
        }
        children = List.copyOf(children);
    }

    @Override
    public String toCypher() {
        return children.stream()
                .map(Predicate::toCypher)
                .collect(Collectors.joining(" " + operator.name() + " ", "(", ")"));
    }

    @Override
    public List<String> parameterNames() {
        List<String> names = new ArrayList<>();
        for (Predicate child : children) {
            names.addAll(child.parameterNames());
        }
        return names;
    }

    @Override
    public Predicate renameParameters(Map<String, String> renames) {
        return new Group(operator, children.stream()
                .map(child -> child.renameParameters(renames))
                .collect(Collectors.toList()));
    }
}
