package com.tensorform.ad.api;

/**
 * Recursion exceeded the configured maximum expression depth.
 */
public class ExpressionTooDeepException extends DifferentiationException {

    public ExpressionTooDeepException(String message) {
        super(message);
    }

    public ExpressionTooDeepException(String message, Throwable cause) {
        super(message, cause);
    }
}
