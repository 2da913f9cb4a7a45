package com.pipeline.adg.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.engine.InvocationResult;
import com.pipeline.adg.engine.RunResult;
import com.pipeline.adg.plan.ExecutionPlan;
import com.pipeline.adg.util.CompositeRunListener;
import com.pipeline.adg.util.ErrorRateLimiter;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hands run events from worker threads to listeners through an LMAX Disruptor.
 *
 * Workers publish with {@code tryPublishEvent}: publishing never blocks, and when
 * the ring buffer is full the event is dropped and counted. A single consumer
 * thread calls the listeners in publication order. A listener that throws is
 * logged through an {@link ErrorRateLimiter} and keeps receiving events.
 *
 * Thread Safety:
 * Any number of threads may publish concurrently (multi-producer ring buffer).
 * Listeners are only ever called from the consumer thread.
 */
public final class AsyncRunEventDispatcher implements RunListener, AutoCloseable {
    private static final Logger log = LogManager.getLogger(AsyncRunEventDispatcher.class);

    private final Disruptor<RunEventSlot> disruptor;
    private final RingBuffer<RunEventSlot> ringBuffer;
    private final CompositeRunListener listeners = new CompositeRunListener();
    private final ErrorRateLimiter listenerErrors;
    private final ErrorRateLimiter dropWarnings;
    private final long shutdownTimeoutMillis;
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong listenerFailures = new AtomicLong();
    private final CountDownLatch consumerStarted = new CountDownLatch(1);
    private volatile boolean closed;

    public AsyncRunEventDispatcher(int bufferSize, long shutdownTimeoutMillis, long errorLogIntervalMillis) {
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
        this.listenerErrors = new ErrorRateLimiter(log, errorLogIntervalMillis);
        this.dropWarnings = new ErrorRateLimiter(log, errorLogIntervalMillis);
        this.disruptor = new Disruptor<>(
                RunEventSlot::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new ListenerHandler());
        this.ringBuffer = disruptor.start();
        awaitConsumerStart();
    }

    // Disruptor.shutdown only drains for processors that are already running,
    // so the consumer must be up before anything is published.
    private void awaitConsumerStart() {
        try {
            consumerStarted.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disruptor.halt();
            throw new IllegalStateException("Interrupted while starting run event dispatcher", e);
        }
    }

    private final class ListenerHandler implements EventHandler<RunEventSlot> {
        @Override
        public void onStart() {
            consumerStarted.countDown();
        }

        @Override
        public void onEvent(RunEventSlot slot, long sequence, boolean endOfBatch) {
            dispatch(slot);
        }
    }

    public void addListener(RunListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(RunListener listener) {
        return listeners.remove(listener);
    }

    @Override
    public void onRunStart(String runId, ExecutionPlan plan) {
        publish(ringBuffer.tryPublishEvent((slot, seq, id, p) -> slot.setRunStart(id, p), runId, plan));
    }

    @Override
    public void onMaterialization(MaterializationEvent event) {
        publish(ringBuffer.tryPublishEvent((slot, seq, e) -> slot.setMaterialization(e), event));
    }

    @Override
    public void onInvocationFinished(String runId, InvocationResult result) {
        publish(ringBuffer.tryPublishEvent((slot, seq, id, r) -> slot.setInvocationFinished(id, r), runId, result));
    }

    @Override
    public void onRunEnd(RunResult result) {
        publish(ringBuffer.tryPublishEvent((slot, seq, r) -> slot.setRunEnd(r), result));
    }

    private void publish(boolean accepted) {
        if (accepted) {
            published.incrementAndGet();
        } else {
            long n = dropped.incrementAndGet();
            dropWarnings.warn("Run event buffer full, " + n + " event(s) dropped so far");
        }
    }

    private void dispatch(RunEventSlot slot) {
        if (listeners.size() == 0) {
            slot.clear();
            return;
        }
        try {
            switch (slot.type()) {
                case RUN_START -> listeners.onRunStart(slot.runId(), slot.plan());
                case MATERIALIZATION -> listeners.onMaterialization(slot.event());
                case INVOCATION_FINISHED -> listeners.onInvocationFinished(slot.runId(), slot.invocation());
                case RUN_END -> listeners.onRunEnd(slot.runResult());
            }
        } catch (RuntimeException e) {
            listenerFailures.incrementAndGet();
            listenerErrors.log("Run listener failed on " + slot.type() + " for run " + slot.runId(), e);
        } finally {
            slot.clear();
        }
    }

    /** Events accepted into the ring buffer. */
    public long publishedCount() {
        return published.get();
    }

    /** Events rejected because the ring buffer was full. */
    public long droppedCount() {
        return dropped.get();
    }

    public long listenerFailureCount() {
        return listenerFailures.get();
    }

    /** Free ring buffer slots. */
    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Waits for queued events to reach the listeners, then stops the consumer
     * thread. Events still queued after the shutdown timeout are abandoned.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        try {
            disruptor.shutdown(shutdownTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Run event dispatcher did not drain within {} ms, halting", shutdownTimeoutMillis);
            disruptor.halt();
        }
        if (dropped.get() > 0)
            log.warn("Run event dispatcher closed with {} dropped event(s)", dropped.get());
    }
}
