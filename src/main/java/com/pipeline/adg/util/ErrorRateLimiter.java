package com.pipeline.adg.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a recurring problem is logged.
 *
 * Used for listener failures and dropped run events, where a broken observer
 * would otherwise write one line per event.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    public void log(String message, Throwable t) {
        if (acquire())
            logger.error(message + " (throttled, " + suppressed.getAndSet(0) + " suppressed)", t);
    }

    public void warn(String message) {
        if (acquire())
            logger.warn(message + " (throttled, " + suppressed.getAndSet(0) + " suppressed)");
    }

    /** Messages dropped since the last one that was written. */
    public long suppressedCount() {
        return suppressed.get();
    }

    private boolean acquire() {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // only one thread logs per interval
        if ((last == 0 || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now))
            return true;
        suppressed.incrementAndGet();
        return false;
    }
}
