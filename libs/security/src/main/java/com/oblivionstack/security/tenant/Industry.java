package com.oblivionstack.security.tenant;

import java.util.Optional;

/** Industry vertical a business operates in. */
public enum Industry {

    SALONS_BARBERSHOPS("salons_barbershops"),
    AUTO_MECHANICS("auto_mechanics"),
    MASSAGE_THERAPY("massage_therapy"),
    FITNESS_WELLNESS("fitness_wellness"),
    OTHER("other");

    private final String value;

    Industry(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Industry> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Industry candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
