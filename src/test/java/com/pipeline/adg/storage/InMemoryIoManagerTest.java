package com.pipeline.adg.storage;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.error.LoadException;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class InMemoryIoManagerTest {
    private static final AssetKey KEY = AssetKey.of("warehouse", "orders");

    @Test
    public void testStoreThenLoad() {
        InMemoryIoManager io = new InMemoryIoManager();
        io.store(KEY, "v1", Map.of("rows", 3));
        assertEquals("v1", io.load(KEY));
        assertEquals(Map.of("rows", 3), io.metadata(KEY));
        io.store(KEY, "v2", null);
        assertEquals("v2", io.load(KEY));
        assertTrue(io.metadata(KEY).isEmpty());
    }

    @Test
    public void testNullValueIsStillPresent() {
        InMemoryIoManager io = new InMemoryIoManager().put(KEY, null);
        assertTrue(io.contains(KEY));
        assertNull(io.load(KEY));
        assertEquals(1, io.size());
    }

    @Test(expected = LoadException.class)
    public void testMissingValue() {
        new InMemoryIoManager().load(KEY);
    }
}
