package com.tensorform.ad.api;

/**
 * A shape or scalar precondition of a differentiation rule does not hold.
 */
public class PreconditionException extends DifferentiationException {

    public PreconditionException(String message) {
        super(message);
    }
}
