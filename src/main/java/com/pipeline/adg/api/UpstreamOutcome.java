package com.pipeline.adg.api;

/**
 * What happened to an input's upstream asset, as seen by the consuming computation.
 */
public enum UpstreamOutcome {
    /** Materialized earlier in this run. */
    PRODUCED,
    /** Its producer ran (or was skipped) in this run without emitting it. */
    DECLINED,
    /** Not produced by this run: a source asset or a previous materialization. */
    EXTERNAL
}
