package com.oblivionstack.accessservice.domain;

/**
 * The target does not exist or the caller may not see it. The two cases are reported the same way.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
