package com.pipeline.adg.storage;

import com.pipeline.adg.api.MaterializationLog;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.MaterializationEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only event log partitioned by asset key.
 *
 * Appends for different keys never contend; appends for one key are serialized
 * by that key's list. The latest event of a key is the last element of its list,
 * so point reads are lock-free.
 */
public class InMemoryMaterializationLog implements MaterializationLog {
    private final Map<AssetKey, CopyOnWriteArrayList<MaterializationEvent>> byKey = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<MaterializationEvent>> byRun = new ConcurrentHashMap<>();
    private final AtomicLong size = new AtomicLong();

    @Override
    public void append(MaterializationEvent event) {
        byKey.computeIfAbsent(event.key(), k -> new CopyOnWriteArrayList<>()).add(event);
        byRun.computeIfAbsent(event.runId(), k -> new CopyOnWriteArrayList<>()).add(event);
        size.incrementAndGet();
    }

    @Override
    public MaterializationEvent latest(AssetKey key) {
        List<MaterializationEvent> events = byKey.get(key);
        if (events == null || events.isEmpty())
            return null;
        return events.get(events.size() - 1);
    }

    @Override
    public List<MaterializationEvent> history(AssetKey key) {
        List<MaterializationEvent> events = byKey.get(key);
        return events == null ? List.of() : List.copyOf(events);
    }

    @Override
    public List<MaterializationEvent> eventsForRun(String runId) {
        List<MaterializationEvent> events = byRun.get(runId);
        return events == null ? List.of() : List.copyOf(events);
    }

    /** Keys with at least one event. */
    public List<AssetKey> materializedKeys() {
        return new ArrayList<>(byKey.keySet());
    }

    @Override
    public long size() {
        return size.get();
    }
}
