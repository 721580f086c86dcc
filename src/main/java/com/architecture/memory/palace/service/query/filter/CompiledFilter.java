package com.architecture.memory.palace.service.query.filter;

import com.architecture.memory.palace.service.query.ParameterBag;
import com.architecture.memory.palace.service.query.predicate.Predicate;

/**
 * Result of compiling a filter expression on its own bag.
 */
public record CompiledFilter(Predicate predicate, ParameterBag parameters) {
}
