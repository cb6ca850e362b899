package com.tensorform.ad.engine;

import com.tensorform.ad.api.DiagnosticSink;
import com.tensorform.ad.api.DifferentiationListener;
import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.Label;
import com.tensorform.ad.io.AdOptions;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State owned by exactly one differentiation run.
 *
 * Holds the two memo caches (node identity to result, variable label to
 * result), the diagnostic sink, the listener and the run counters. A context
 * is created fresh for every run and never shared between runs or threads.
 */
public final class AdContext {
    private static final AtomicLong RUN_IDS = new AtomicLong();

    private final long runId = RUN_IDS.incrementAndGet();
    private final AdOptions options;
    private final DiagnosticSink sink;
    private final DifferentiationListener listener;

    // Keyed on node identity; structurally equal nodes are visited separately
    private final Map<Expr, Dual> cache = new IdentityHashMap<>();
    private final Map<Label, Dual> variableCache = new HashMap<>();
    private final Set<String> warned = new HashSet<>();

    private int depth;
    private int rulesApplied;
    private int cacheHits;

    /**
     * @param listener may be {@code null}.
     */
    public AdContext(AdOptions options, DiagnosticSink sink, DifferentiationListener listener) {
        this.options = options;
        this.sink = sink;
        this.listener = listener;
    }

    public long runId() {
        return runId;
    }

    public AdOptions options() {
        return options;
    }

    public DiagnosticSink sink() {
        return sink;
    }

    public DifferentiationListener listener() {
        return listener;
    }

    Map<Expr, Dual> cache() {
        return cache;
    }

    Map<Label, Dual> variableCache() {
        return variableCache;
    }

    /** Number of distinct nodes differentiated so far. */
    public int rulesApplied() {
        return rulesApplied;
    }

    public int cacheHits() {
        return cacheHits;
    }

    /** Current recursion depth. */
    public int depth() {
        return depth;
    }

    int enter() {
        return ++depth;
    }

    void exit() {
        depth--;
    }

    void ruleApplied() {
        rulesApplied++;
    }

    void cacheHit() {
        cacheHits++;
    }

    /**
     * Emits a warning through the sink once per key and run.
     */
    public void warnOnce(String key, String message) {
        if (warned.add(key))
            sink.warn(message);
    }
}
