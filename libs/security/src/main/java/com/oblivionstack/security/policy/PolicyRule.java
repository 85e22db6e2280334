package com.oblivionstack.security.policy;

import java.util.EnumSet;
import java.util.Set;

/**
 * A named permissive policy: for the listed operations, a row is accessible when the predicate
 * holds. Rules on the same resource are OR-ed.
 *
 * @param name       unique name within the resource
 * @param operations operations governed
 * @param predicate  row filter
 */
public record PolicyRule(String name, Set<Operation> operations, RowPredicate predicate) {

    public PolicyRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("operations must not be null or empty");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate must not be null");
        }
        operations = Set.copyOf(EnumSet.copyOf(operations));
    }

    public static PolicyRule of(String name, Operation operation, RowPredicate predicate) {
        return new PolicyRule(name, EnumSet.of(operation), predicate);
    }

    public boolean appliesTo(Operation operation) {
        return operations.contains(operation);
    }
}
