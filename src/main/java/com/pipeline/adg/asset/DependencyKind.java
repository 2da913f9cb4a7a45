package com.pipeline.adg.asset;

/**
 * How a downstream computation relates to one of its upstream assets.
 */
public enum DependencyKind {
    /** Ordering only: the upstream must complete first, no data is threaded through. */
    EXPLICIT,
    /** The upstream's materialized value is fetched through its I/O manager and passed in. */
    LOADED;

    /** The stronger of two kinds, used when one upstream is referenced both ways. */
    public static DependencyKind strongest(DependencyKind a, DependencyKind b) {
        return a == LOADED || b == LOADED ? LOADED : EXPLICIT;
    }
}
