package com.tensorform.ad.api;

/**
 * A summation index bound inside the differentiated expression coincides with
 * a free index of the differentiation variable.
 */
public class IndexScopeCollisionException extends DifferentiationException {

    public IndexScopeCollisionException(String message) {
        super(message);
    }
}
