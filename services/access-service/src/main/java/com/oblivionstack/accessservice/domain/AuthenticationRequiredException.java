package com.oblivionstack.accessservice.domain;

/** The operation needs a resolved user identity and the request carried none. */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
