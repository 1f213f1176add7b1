package com.onevault.identity;

/**
 * Thrown when an identity input is malformed: a null or blank tenant key, business key or record
 * source, or a hash key of the wrong length.
 *
 * <p>WHY extend IllegalArgumentException: this is a caller error. It is never retried
 * automatically and maps naturally to a 400-style response at the routing layer.
 */
public class IdentityValidationException extends IllegalArgumentException {

    public IdentityValidationException(String message) {
        super(message);
    }
}
