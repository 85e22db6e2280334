package com.oblivionstack.security.tenant;

/**
 * Thrown when a business is created with a slug that is already taken.
 */
public class DuplicateSlugException extends RuntimeException {

    private final String slug;

    public DuplicateSlugException(String slug) {
        super("Business slug '%s' is already taken".formatted(slug));
        this.slug = slug;
    }

    public String slug() {
        return slug;
    }
}
