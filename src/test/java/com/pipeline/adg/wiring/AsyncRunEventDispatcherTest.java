package com.pipeline.adg.wiring;

import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.engine.RunResult;
import org.junit.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class AsyncRunEventDispatcherTest {

    private static RunResult result(String runId) {
        Instant now = Instant.now();
        return new RunResult(runId, RunResult.RunStatus.SUCCEEDED, Map.of(), now, now);
    }

    private static RunListener recorder(List<String> seen) {
        return new RunListener() {
            @Override
            public void onRunEnd(RunResult result) {
                seen.add(result.runId());
            }
        };
    }

    @Test
    public void testEventsDeliveredInOrder() {
        List<String> seen = new CopyOnWriteArrayList<>();
        AsyncRunEventDispatcher dispatcher = new AsyncRunEventDispatcher(16, 2000, 1000);
        dispatcher.addListener(recorder(seen));
        for (int i = 0; i < 10; i++)
            dispatcher.onRunEnd(result("r" + i));
        dispatcher.close();

        assertEquals(List.of("r0", "r1", "r2", "r3", "r4", "r5", "r6", "r7", "r8", "r9"), seen);
        assertEquals(10, dispatcher.publishedCount());
        assertEquals(0, dispatcher.droppedCount());
    }

    @Test
    public void testCloseImmediatelyAfterConstructionDrainsEvents() {
        for (int round = 0; round < 20; round++) {
            List<String> seen = new CopyOnWriteArrayList<>();
            AsyncRunEventDispatcher dispatcher = new AsyncRunEventDispatcher(16, 2000, 1000);
            dispatcher.addListener(recorder(seen));
            for (int i = 0; i < 5; i++)
                dispatcher.onRunEnd(result("r" + i));
            dispatcher.close();
            assertEquals("round " + round, List.of("r0", "r1", "r2", "r3", "r4"), seen);
        }
    }

    @Test
    public void testFullBufferDropsInsteadOfBlocking() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> seen = new CopyOnWriteArrayList<>();
        AsyncRunEventDispatcher dispatcher = new AsyncRunEventDispatcher(2, 2000, 1000);
        dispatcher.addListener(new RunListener() {
            @Override
            public void onRunEnd(RunResult result) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                seen.add(result.runId());
            }
        });

        dispatcher.onRunEnd(result("first"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        // the consumer is stuck on "first", which still occupies its slot
        for (int i = 0; i < 4; i++)
            dispatcher.onRunEnd(result("extra" + i));

        assertEquals(2, dispatcher.publishedCount());
        assertEquals(3, dispatcher.droppedCount());
        release.countDown();
        dispatcher.close();
        assertEquals(List.of("first", "extra0"), seen);
    }

    @Test
    public void testThrowingListenerDoesNotStopDelivery() {
        List<String> seen = new CopyOnWriteArrayList<>();
        AsyncRunEventDispatcher dispatcher = new AsyncRunEventDispatcher(16, 2000, 1000);
        dispatcher.addListener(recorder(seen));
        dispatcher.addListener(new RunListener() {
            @Override
            public void onRunEnd(RunResult result) {
                throw new IllegalStateException("broken observer");
            }
        });
        dispatcher.onRunEnd(result("a"));
        dispatcher.onRunEnd(result("b"));
        dispatcher.close();

        assertEquals(List.of("a", "b"), seen);
        assertEquals(2, dispatcher.listenerFailureCount());
    }

    @Test
    public void testRemovedListenerStopsReceiving() {
        List<String> seen = new CopyOnWriteArrayList<>();
        RunListener listener = recorder(seen);
        AsyncRunEventDispatcher dispatcher = new AsyncRunEventDispatcher(16, 2000, 1000);
        dispatcher.addListener(listener);
        assertTrue(dispatcher.removeListener(listener));
        assertFalse(dispatcher.removeListener(listener));
        dispatcher.onRunEnd(result("ignored"));
        dispatcher.close();
        assertTrue(seen.isEmpty());
    }
}
