package com.tensorform.ad.util;

import com.tensorform.ad.api.DifferentiationListener;
import com.tensorform.ad.api.Expr;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link DifferentiationListener} instances,
 * iterating a plain array.
 */
public class CompositeDifferentiationListener implements DifferentiationListener {
    private DifferentiationListener[] listeners = new DifferentiationListener[0];

    public void addForComposite(DifferentiationListener listener) {
        DifferentiationListener[] old = listeners;
        DifferentiationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(long runId, String variable) {
        for (DifferentiationListener l : listeners)
            l.onRunStart(runId, variable);
    }

    @Override
    public void onRuleApplied(long runId, Expr node, long durationNanos) {
        for (DifferentiationListener l : listeners)
            l.onRuleApplied(runId, node, durationNanos);
    }

    @Override
    public void onCacheHit(long runId, Expr node) {
        for (DifferentiationListener l : listeners)
            l.onCacheHit(runId, node);
    }

    @Override
    public void onRunEnd(long runId, int rulesApplied, int cacheHits) {
        for (DifferentiationListener l : listeners)
            l.onRunEnd(runId, rulesApplied, cacheHits);
    }
}
