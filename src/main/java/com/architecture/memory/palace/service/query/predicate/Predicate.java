package com.architecture.memory.palace.service.query.predicate;

import java.util.List;
import java.util.Map;

/**
 * Node of a compiled filter. Nodes reference parameters by name and never hold values.
 */
public interface Predicate {

    /**
     * Render as a Cypher boolean expression (without the WHERE keyword).
     */
    String toCypher();

    /**
     * Names of the parameters this predicate references, in rendering order.
     */
    List<String> parameterNames();

    /**
     * Copy of this predicate with every parameter reference replaced through {@code renames}.
     *
     * @throws IllegalArgumentException if a referenced name has no entry in the mapping
     */
    Predicate renameParameters(Map<String, String> renames);
}
