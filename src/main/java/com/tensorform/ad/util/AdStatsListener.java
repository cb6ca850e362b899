package com.tensorform.ad.util;

import com.tensorform.ad.api.DifferentiationListener;
import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Aggregates differentiation statistics per node kind and per run.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Per kind:</b> number of rule applications and time spent, children
 * included.</li>
 * <li><b>Per node:</b> how often each node object of the current run was
 * differentiated. Memoization keeps this at one.</li>
 * <li><b>Totals:</b> runs, rule applications, cache hits and run latency.</li>
 * </ul>
 */
public class AdStatsListener implements DifferentiationListener {

    public static class KindStats {
        public final ExprKind kind;
        public long count;
        public long totalDurationNanos;
        public long maxDurationNanos;

        public KindStats(ExprKind kind) {
            this.kind = kind;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Indexed by ExprKind ordinal
    private final KindStats[] kindStats = new KindStats[ExprKind.values().length];
    private final Map<Expr, Integer> nodeApplications = new IdentityHashMap<>();

    private long runStartNanos, lastRunNanos;
    private long totalRuns, totalRulesApplied, totalCacheHits;
    private int lastRulesApplied, lastCacheHits;
    private String lastVariable;

    @Override
    public void onRunStart(long runId, String variable) {
        nodeApplications.clear();
        lastVariable = variable;
        runStartNanos = System.nanoTime();
    }

    @Override
    public void onRuleApplied(long runId, Expr node, long durationNanos) {
        int k = node.kind().ordinal();
        if (kindStats[k] == null)
            kindStats[k] = new KindStats(node.kind());
        kindStats[k].update(durationNanos);
        nodeApplications.merge(node, 1, Integer::sum);
    }

    @Override
    public void onCacheHit(long runId, Expr node) {
        // Counted by the context and reported at run end
    }

    @Override
    public void onRunEnd(long runId, int rulesApplied, int cacheHits) {
        lastRunNanos = System.nanoTime() - runStartNanos;
        lastRulesApplied = rulesApplied;
        lastCacheHits = cacheHits;
        totalRuns++;
        totalRulesApplied += rulesApplied;
        totalCacheHits += cacheHits;
    }

    /** Times {@code node} was differentiated in the current or last run. */
    public int applications(Expr node) {
        return nodeApplications.getOrDefault(node, 0);
    }

    /** Largest per-node application count of the current or last run. */
    public int maxApplicationsPerNode() {
        int max = 0;
        for (int n : nodeApplications.values())
            max = Math.max(max, n);
        return max;
    }

    public long count(ExprKind kind) {
        KindStats s = kindStats[kind.ordinal()];
        return s == null ? 0 : s.count;
    }

    public KindStats[] getKindStats() {
        return kindStats;
    }

    public long totalRuns() {
        return totalRuns;
    }

    public long totalRulesApplied() {
        return totalRulesApplied;
    }

    public long totalCacheHits() {
        return totalCacheHits;
    }

    public int lastRulesApplied() {
        return lastRulesApplied;
    }

    public int lastCacheHits() {
        return lastCacheHits;
    }

    public String lastVariable() {
        return lastVariable;
    }

    public double lastRunMicros() {
        return lastRunNanos / 1000.0;
    }

    public void reset() {
        Arrays.fill(kindStats, null);
        nodeApplications.clear();
        totalRuns = 0;
        totalRulesApplied = 0;
        totalCacheHits = 0;
        lastRulesApplied = 0;
        lastCacheHits = 0;
        lastRunNanos = 0;
    }

    /** Formatted table of per-kind statistics, most expensive first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s%n", "Kind", "Count", "Avg (us)", "Max (us)"));
        sb.append("----------------------------------------------------------\n");

        KindStats[] valid = Arrays.stream(kindStats)
                .filter(s -> s != null && s.count > 0)
                .toArray(KindStats[]::new);
        Arrays.sort(valid, (s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (KindStats s : valid) {
            sb.append(String.format("%-20s | %10d | %10.2f | %10.2f%n",
                    s.kind, s.count, s.avgMicros(), s.maxDurationNanos / 1000.0));
        }
        sb.append(String.format("Runs: %d, rules applied: %d, cache hits: %d%n",
                totalRuns, totalRulesApplied, totalCacheHits));
        return sb.toString();
    }
}
