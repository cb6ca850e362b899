package com.tensorform.ad.util;

import com.tensorform.ad.api.DiagnosticSink;
import com.tensorform.ad.api.DifferentiationException;

import lombok.extern.log4j.Log4j2;

/**
 * Default sink: warnings go to {@code log.warn}, failures to {@code log.error}
 * before the error is thrown.
 */
@Log4j2
public final class LoggingDiagnosticSink implements DiagnosticSink {
    public static final LoggingDiagnosticSink INSTANCE = new LoggingDiagnosticSink();

    @Override
    public void warn(String message) {
        log.warn(message);
    }

    @Override
    public void fail(DifferentiationException error) {
        log.error("{}: {}", error.getClass().getSimpleName(), error.getMessage());
        throw error;
    }
}
