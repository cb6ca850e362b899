package com.tensorform.ad.util;

import com.tensorform.ad.api.DiagnosticSink;
import com.tensorform.ad.api.DifferentiationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every diagnostic of a run for later inspection, optionally forwarding
 * to another sink.
 *
 * <p>
 * Used to audit silent-zero assumptions (missing coefficient derivatives,
 * conditions that depend on the variable) after a batch of runs.
 */
public final class RecordingDiagnosticSink implements DiagnosticSink {
    private final DiagnosticSink delegate;
    private final List<String> warnings = new ArrayList<>();
    private final List<DifferentiationException> errors = new ArrayList<>();

    public RecordingDiagnosticSink() {
        this(null);
    }

    /**
     * @param delegate receives every diagnostic after it is recorded; may be
     *                 {@code null}.
     */
    public RecordingDiagnosticSink(DiagnosticSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void warn(String message) {
        warnings.add(message);
        if (delegate != null)
            delegate.warn(message);
    }

    @Override
    public void fail(DifferentiationException error) {
        errors.add(error);
        if (delegate != null)
            delegate.fail(error);
        throw error;
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<DifferentiationException> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isClean() {
        return warnings.isEmpty() && errors.isEmpty();
    }

    public void clear() {
        warnings.clear();
        errors.clear();
    }
}
