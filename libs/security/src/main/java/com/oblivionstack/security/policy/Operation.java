package com.oblivionstack.security.policy;

import java.util.Optional;

/** Data-access operations a policy rule can govern. */
public enum Operation {

    SELECT("select"),
    INSERT("insert"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isWrite() {
        return this != SELECT;
    }

    public static Optional<Operation> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Operation operation : values()) {
            if (operation.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
