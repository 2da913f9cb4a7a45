package com.pipeline.adg.asset;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Objects;

/**
 * Governs re-execution of a step invocation after its computation raised.
 *
 * A deliberate non-emission of an output is never retried, only raised failures.
 *
 * Delay shapes, where {@code n} is the 1-based retry number:
 * <ul>
 * <li>{@link Backoff#CONSTANT}: {@code delay}</li>
 * <li>{@link Backoff#EXPONENTIAL}: {@code delay * 2^(n-1)}</li>
 * </ul>
 * {@link Jitter#SYMMETRIC} then moves the computed delay uniformly within
 * {@code [d/2, 3d/2]}.
 *
 * Delays have millisecond resolution. A non-zero delay shorter than one
 * millisecond is treated as one millisecond.
 *
 * @param maxRetries Retries after the initial attempt; 3 means at most 4 attempts.
 * @param delay      Base delay before the first retry.
 * @param backoff    Delay growth between retries.
 * @param jitter     Randomization applied to each computed delay.
 */
public record RetryPolicy(int maxRetries, Duration delay, Backoff backoff, Jitter jitter) {

    private static final Duration MIN_DELAY = Duration.ofMillis(1);
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final double JITTER_FACTOR = 0.5;

    public enum Backoff {
        CONSTANT, EXPONENTIAL
    }

    public enum Jitter {
        NONE, SYMMETRIC
    }

    public RetryPolicy {
        if (maxRetries < 0)
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative())
            throw new IllegalArgumentException("delay must be >= 0, got " + delay);
        backoff = backoff == null ? Backoff.CONSTANT : backoff;
        jitter = jitter == null ? Jitter.NONE : jitter;
    }

    public static RetryPolicy of(int maxRetries) {
        return new RetryPolicy(maxRetries, Duration.ZERO, Backoff.CONSTANT, Jitter.NONE);
    }

    public static RetryPolicy of(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, delay, Backoff.CONSTANT, Jitter.NONE);
    }

    public RetryPolicy withBackoff(Backoff backoff) {
        return new RetryPolicy(maxRetries, delay, backoff, jitter);
    }

    public RetryPolicy withJitter(Jitter jitter) {
        return new RetryPolicy(maxRetries, delay, backoff, jitter);
    }

    /** True while another attempt is allowed after {@code attemptsSoFar} failed attempts. */
    public boolean allowsRetry(int attemptsSoFar) {
        return attemptsSoFar <= maxRetries;
    }

    /**
     * Delay before the given retry.
     *
     * @param retryNumber 1 for the first retry, 2 for the second, ...
     */
    public Duration delayFor(int retryNumber) {
        if (retryNumber < 1)
            throw new IllegalArgumentException("retryNumber starts at 1, got " + retryNumber);
        if (delay.isZero())
            return Duration.ZERO;
        return Duration.ofMillis(intervalFunction().apply(retryNumber));
    }

    private IntervalFunction intervalFunction() {
        Duration base = delay.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : delay;
        boolean jittered = jitter == Jitter.SYMMETRIC;
        return switch (backoff) {
            case CONSTANT -> jittered
                    ? IntervalFunction.ofRandomized(base, JITTER_FACTOR)
                    : IntervalFunction.of(base);
            case EXPONENTIAL -> jittered
                    ? IntervalFunction.ofExponentialRandomBackoff(base, BACKOFF_MULTIPLIER, JITTER_FACTOR)
                    : IntervalFunction.ofExponentialBackoff(base, BACKOFF_MULTIPLIER);
        };
    }
}
