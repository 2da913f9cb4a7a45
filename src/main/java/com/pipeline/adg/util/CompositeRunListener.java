package com.pipeline.adg.util;

import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.engine.InvocationResult;
import com.pipeline.adg.engine.RunResult;
import com.pipeline.adg.plan.ExecutionPlan;

import java.util.Arrays;

/**
 * Fans run events out to several {@link RunListener} instances.
 *
 * Registration copies the backing array, so iteration never allocates and never
 * sees a half-registered listener.
 */
public class CompositeRunListener implements RunListener {
    private volatile RunListener[] listeners = new RunListener[0];

    public synchronized void add(RunListener listener) {
        RunListener[] old = listeners;
        RunListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(RunListener listener) {
        RunListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                RunListener[] next = new RunListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(String runId, ExecutionPlan plan) {
        for (RunListener l : listeners)
            l.onRunStart(runId, plan);
    }

    @Override
    public void onMaterialization(MaterializationEvent event) {
        for (RunListener l : listeners)
            l.onMaterialization(event);
    }

    @Override
    public void onInvocationFinished(String runId, InvocationResult result) {
        for (RunListener l : listeners)
            l.onInvocationFinished(runId, result);
    }

    @Override
    public void onRunEnd(RunResult result) {
        for (RunListener l : listeners)
            l.onRunEnd(result);
    }
}
