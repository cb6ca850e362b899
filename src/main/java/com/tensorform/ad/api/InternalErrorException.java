package com.tensorform.ad.api;

/**
 * An engine invariant was violated. Indicates a bug rather than a user error.
 */
public class InternalErrorException extends DifferentiationException {

    public InternalErrorException(String message) {
        super(message);
    }
}
