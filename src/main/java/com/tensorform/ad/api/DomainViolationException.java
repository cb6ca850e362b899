package com.tensorform.ad.api;

/**
 * The derivative is undefined for the given primal, e.g. the logarithm of a
 * structural zero.
 */
public class DomainViolationException extends DifferentiationException {

    public DomainViolationException(String message) {
        super(message);
    }
}
