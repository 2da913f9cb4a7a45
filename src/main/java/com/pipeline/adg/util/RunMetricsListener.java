package com.pipeline.adg.util;

import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.engine.InvocationResult;
import com.pipeline.adg.engine.InvocationStatus;
import com.pipeline.adg.engine.RunResult;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks run and invocation counters and latencies.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Runs:</b> total, failed, cancelled, and min/avg/max run duration.</li>
 * <li><b>Invocations:</b> count per terminal status and retries performed.</li>
 * <li><b>Materializations:</b> events recorded.</li>
 * </ul>
 *
 * Events arrive on the dispatcher thread only, so the counters need no locking;
 * readers on other threads see eventually consistent values.
 */
public final class RunMetricsListener implements RunListener {
    private static final Logger log = LogManager.getLogger(RunMetricsListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private volatile long totalRuns, failedRuns, cancelledRuns;
    private volatile long totalRunMillis;
    private volatile long minRunMillis = Long.MAX_VALUE, maxRunMillis = Long.MIN_VALUE;
    private final long[] invocationsByStatus = new long[InvocationStatus.values().length];
    private volatile long retries;
    private volatile long materializations;

    @Override
    public void onMaterialization(MaterializationEvent event) {
        materializations++;
    }

    @Override
    public void onInvocationFinished(String runId, InvocationResult result) {
        invocationsByStatus[result.status().ordinal()]++;
        retries += result.retryDelays().size();
        if (result.status() == InvocationStatus.FAILED && !result.isShortCircuited())
            errLimiter.log(String.format("Run %s step '%s' failed", runId, result.stepName()), result.error());
    }

    @Override
    public void onRunEnd(RunResult result) {
        long millis = result.elapsed().toMillis();
        totalRuns++;
        totalRunMillis += millis;
        switch (result.status()) {
            case FAILED -> failedRuns++;
            case CANCELED -> cancelledRuns++;
            default -> {
            }
        }
        if (millis < minRunMillis)
            minRunMillis = millis;
        if (millis > maxRunMillis)
            maxRunMillis = millis;
    }

    public long totalRuns() {
        return totalRuns;
    }

    public long failedRuns() {
        return failedRuns;
    }

    public long cancelledRuns() {
        return cancelledRuns;
    }

    public long invocations(InvocationStatus status) {
        return invocationsByStatus[status.ordinal()];
    }

    public long retries() {
        return retries;
    }

    public long materializations() {
        return materializations;
    }

    public double avgRunMillis() {
        return totalRuns > 0 ? (double) totalRunMillis / totalRuns : 0;
    }

    public long minRunMillis() {
        return minRunMillis == Long.MAX_VALUE ? 0 : minRunMillis;
    }

    public long maxRunMillis() {
        return maxRunMillis == Long.MIN_VALUE ? 0 : maxRunMillis;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s%n", "Metric", "Value", "Avg (ms)", "Min (ms)",
                "Max (ms)"));
        sb.append("------------------------------------------------------------------------%n".formatted());
        sb.append(String.format("%-20s | %10d | %10.2f | %10d | %10d%n", "Runs", totalRuns, avgRunMillis(),
                minRunMillis(), maxRunMillis()));
        sb.append(String.format("%-20s | %10d%n", "Failed runs", failedRuns));
        for (InvocationStatus s : InvocationStatus.values())
            if (s.isTerminal())
                sb.append(String.format("%-20s | %10d%n", "Invocations " + s, invocations(s)));
        sb.append(String.format("%-20s | %10d%n", "Retries", retries));
        sb.append(String.format("%-20s | %10d%n", "Materializations", materializations));
        return sb.toString();
    }
}
