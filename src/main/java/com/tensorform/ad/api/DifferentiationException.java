package com.tensorform.ad.api;

/**
 * Base class of every fatal condition raised by the differentiation engine.
 *
 * A fatal condition aborts the whole run. No partial derivative is returned.
 */
public class DifferentiationException extends RuntimeException {

    public DifferentiationException(String message) {
        super(message);
    }

    public DifferentiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
