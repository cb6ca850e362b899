package com.tensorform.ad.api;

/**
 * A node kind reached the engine without a differentiation rule, typically a
 * compound operator that should have been expanded upstream.
 */
public class MissingRuleException extends DifferentiationException {

    public MissingRuleException(String message) {
        super(message);
    }
}
