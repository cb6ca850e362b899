package com.tensorform.ad.api;

/**
 * Observability interface for monitoring differentiation runs.
 *
 * Implementations can be registered with the driver to receive callbacks
 * while the engine walks an expression DAG. This is the hook for:
 *
 * - Tracing: logging which rule fired for which node.
 * - Profiling: measuring time spent per node kind.
 * - Verification: counting how often each node was actually differentiated,
 * which must be at most once per run.
 *
 * Callbacks run inside the recursive descent. Keep them cheap.
 */
public interface DifferentiationListener {

    /**
     * Called before the first node of a run is visited.
     *
     * @param runId    identifier of the run, unique within the process.
     * @param variable human-readable description of the differentiation
     *                 variable.
     */
    void onRunStart(long runId, String variable);

    /**
     * Called after a rule produced a result for a node not seen before in this
     * run.
     *
     * @param runId         current run.
     * @param node          the visited node.
     * @param durationNanos time spent in the rule, children included.
     */
    void onRuleApplied(long runId, Expr node, long durationNanos);

    /**
     * Called when a node was served from the run's memo cache.
     *
     * @param runId current run.
     * @param node  the visited node.
     */
    void onCacheHit(long runId, Expr node);

    /**
     * Called when the run finishes, successfully or not.
     *
     * @param runId        current run.
     * @param rulesApplied number of rule evaluations.
     * @param cacheHits    number of memo cache hits.
     */
    void onRunEnd(long runId, int rulesApplied, int cacheHits);
}
