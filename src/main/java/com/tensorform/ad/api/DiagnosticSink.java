package com.tensorform.ad.api;

/**
 * Receives diagnostics raised during one differentiation run.
 *
 * Warnings are non-fatal: the run continues with a documented default (usually
 * a correctly signed zero). Failures abort the run; an implementation of
 * {@link #fail(DifferentiationException)} must not return normally.
 */
public interface DiagnosticSink {

    /**
     * Records a non-fatal condition.
     *
     * @param message free-form description.
     */
    void warn(String message);

    /**
     * Records a fatal condition and aborts the run by throwing {@code error}.
     *
     * @param error the condition, thrown unchanged.
     * @throws DifferentiationException always.
     */
    void fail(DifferentiationException error);
}
