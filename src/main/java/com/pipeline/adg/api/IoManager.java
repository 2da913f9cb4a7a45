package com.pipeline.adg.api;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.error.LoadException;
import com.pipeline.adg.error.StoreException;

import java.util.Map;

/**
 * Storage contract used to hand values between steps.
 *
 * The engine treats values as opaque. A backend must be able to satisfy
 * {@link #load(AssetKey)} for a source asset purely from external state.
 * Implementations are called concurrently from worker threads.
 */
public interface IoManager {

    /**
     * Persists the value produced for {@code key}.
     *
     * @throws StoreException if the value could not be stored.
     */
    void store(AssetKey key, Object value, Map<String, Object> metadata);

    /**
     * Loads the current value of {@code key}.
     *
     * @throws LoadException if no value is available.
     */
    Object load(AssetKey key);
}
