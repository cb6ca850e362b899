package com.tensorform.ad.util;

import com.tensorform.ad.api.DifferentiationListener;
import com.tensorform.ad.api.Expr;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logs every rule application and cache hit at debug level.
 *
 * <p>
 * Enabled by {@code AdOptions.trace}. Output is one line per visited node, so
 * keep it off for large forms.
 */
public final class TracingListener implements DifferentiationListener {
    private static final Logger log = LogManager.getLogger(TracingListener.class);

    @Override
    public void onRunStart(long runId, String variable) {
        log.debug("[run {}] differentiating with respect to {}", runId, variable);
    }

    @Override
    public void onRuleApplied(long runId, Expr node, long durationNanos) {
        if (log.isDebugEnabled())
            log.debug("[run {}] {} {} -> {} ({} ns)", runId, node.kind(), node.shape(), node.freeIndices(),
                    durationNanos);
    }

    @Override
    public void onCacheHit(long runId, Expr node) {
        log.debug("[run {}] cache hit {}", runId, node.kind());
    }

    @Override
    public void onRunEnd(long runId, int rulesApplied, int cacheHits) {
        log.debug("[run {}] done: {} rules applied, {} cache hits", runId, rulesApplied, cacheHits);
    }
}
