package com.oblivionstack.security.policy;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which of the four CRUD policies a template should emit.
 */
public record PolicyFlags(boolean select, boolean insert, boolean update, boolean delete) {

    private static final PolicyFlags ALL = new PolicyFlags(true, true, true, true);

    public static PolicyFlags all() {
        return ALL;
    }

    public static PolicyFlags readOnly() {
        return new PolicyFlags(true, false, false, false);
    }

    public static PolicyFlags of(Set<Operation> operations) {
        return new PolicyFlags(
                operations.contains(Operation.SELECT),
                operations.contains(Operation.INSERT),
                operations.contains(Operation.UPDATE),
                operations.contains(Operation.DELETE));
    }

    public boolean enabled(Operation operation) {
        return switch (operation) {
            case SELECT -> select;
            case INSERT -> insert;
            case UPDATE -> update;
            case DELETE -> delete;
        };
    }

    public Set<Operation> operations() {
        Set<Operation> result = EnumSet.noneOf(Operation.class);
        for (Operation operation : Operation.values()) {
            if (enabled(operation)) {
                result.add(operation);
            }
        }
        return result;
    }
}
