package com.pipeline.adg.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.adg.asset.RetryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

import lombok.Data;

/**
 * Execution engine settings, bound from JSON.
 *
 * <pre>
 * {
 *   "maxParallelism": 4,
 *   "eventBufferSize": 1024,
 *   "defaultRetry": { "maxRetries": 2, "delayMillis": 500, "backoff": "EXPONENTIAL" }
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Worker threads running step invocations. */
    private int maxParallelism = Math.max(2, Runtime.getRuntime().availableProcessors());

    /** Ring buffer slots for run events headed to listeners. Must be a power of two. */
    private int eventBufferSize = 1024;

    /** Wait for in-flight work and queued listener events on close. */
    private long shutdownTimeoutMillis = 5_000;

    /** Minimum gap between two log lines about the same listener problem. */
    private long observerErrorLogIntervalMillis = 1_000;

    /** Applied to steps that declare no retry policy of their own. */
    private RetrySettings defaultRetry;

    /** JSON form of a {@link RetryPolicy}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RetrySettings {
        private int maxRetries;
        private long delayMillis;
        private RetryPolicy.Backoff backoff = RetryPolicy.Backoff.CONSTANT;
        private RetryPolicy.Jitter jitter = RetryPolicy.Jitter.NONE;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries, Duration.ofMillis(delayMillis), backoff, jitter);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), EngineConfig.class).validate();
    }

    public static EngineConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, EngineConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed engine config", e);
        }
    }

    public static EngineConfig fromResource(String resource) {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Engine config resource not found: " + resource);
            return MAPPER.readValue(in, EngineConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load engine config from " + resource, e);
        }
    }

    /** The default retry policy, or null when none is configured. */
    public RetryPolicy defaultRetryPolicy() {
        return defaultRetry == null ? null : defaultRetry.toPolicy();
    }

    public EngineConfig validate() {
        if (maxParallelism < 1)
            throw new IllegalArgumentException("maxParallelism must be >= 1, got " + maxParallelism);
        if (eventBufferSize < 1 || Integer.bitCount(eventBufferSize) != 1)
            throw new IllegalArgumentException("eventBufferSize must be a power of two, got " + eventBufferSize);
        if (shutdownTimeoutMillis < 0)
            throw new IllegalArgumentException("shutdownTimeoutMillis must be >= 0");
        return this;
    }
}
