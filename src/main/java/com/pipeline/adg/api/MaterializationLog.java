package com.pipeline.adg.api;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.MaterializationEvent;

import java.util.List;

/**
 * Append-only log of materialization events.
 *
 * Must accept concurrent appends without losing any, and answer concurrent
 * "latest event for key" reads.
 */
public interface MaterializationLog {

    void append(MaterializationEvent event);

    /** The current materialization of {@code key}, or null if it was never materialized. */
    MaterializationEvent latest(AssetKey key);

    /** Every event for {@code key}, oldest first. */
    List<MaterializationEvent> history(AssetKey key);

    /** Every event appended by the run, in append order. */
    List<MaterializationEvent> eventsForRun(String runId);

    long size();
}
