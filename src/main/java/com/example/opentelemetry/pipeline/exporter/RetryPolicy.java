package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.config.ExporterConfig;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Exponential backoff between delivery attempts: {@code initialInterval * multiplier^(attempt - 1)}, capped at
 * {@code maxInterval}. A delay requested by the backend takes precedence when it is longer.
 */
public class RetryPolicy {

    private final boolean enabled;
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double multiplier;
    private final int maxAttempts;

    public RetryPolicy(ExporterConfig.RetryConfig config) {
        this.enabled = config.enabled();
        this.initialInterval = config.initialInterval();
        this.maxInterval = config.maxInterval();
        this.multiplier = config.multiplier();
        this.maxAttempts = config.maxAttempts();
    }

    public boolean canRetry(int attempts) {
        return enabled && attempts < maxAttempts;
    }

    public Duration backoff(int attempt, @Nullable Duration retryAfter) {
        double nanos = initialInterval.toNanos() * Math.pow(multiplier, Math.max(0, attempt - 1));
        Duration delay = nanos >= maxInterval.toNanos() ? maxInterval : Duration.ofNanos((long) nanos);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            return retryAfter.compareTo(maxInterval) > 0 ? maxInterval : retryAfter;
        }
        return delay;
    }

    public int maxAttempts() {
        return enabled ? maxAttempts : 1;
    }
}
