package com.example.opentelemetry.pipeline.config;

import com.example.opentelemetry.pipeline.model.SignalType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration of one named sink.
 *
 * @param endpoint        base address of the backend; {@code host:port} for gRPC, a URL for HTTP
 * @param metricsEndpoint overrides {@code endpoint} for metrics
 * @param logsEndpoint    overrides {@code endpoint} for logs
 * @param tracesEndpoint  overrides {@code endpoint} for traces
 * @param timeout         deadline of a single delivery attempt
 * @param queueSize       number of batches waiting for this exporter before new ones are dropped
 */
public record ExporterConfig(ExporterType type,
                             @Nullable String endpoint,
                             @Nullable String metricsEndpoint,
                             @Nullable String logsEndpoint,
                             @Nullable String tracesEndpoint,
                             Map<String, String> headers,
                             Duration timeout,
                             RetryConfig retry,
                             Integer queueSize) {

    public ExporterConfig {
        headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        retry = retry == null ? new RetryConfig(null, null, null, null, null) : retry;
        queueSize = queueSize == null ? 100 : queueSize;
    }

    /**
     * The endpoint records of the given signal are sent to: the signal specific one when configured, otherwise
     * the base {@link #endpoint()} ({@code null} when neither is set). For {@link ExporterType#OTLP_HTTP} the
     * base endpoint is suffixed with the OTLP path of the signal, e.g. {@code /v1/metrics}.
     */
    @Nullable
    public String endpointFor(SignalType signal) {
        String specific = switch (signal) {
            case METRIC -> metricsEndpoint;
            case LOG -> logsEndpoint;
            case SPAN -> tracesEndpoint;
        };
        if (specific != null) {
            return specific;
        }
        if (endpoint == null) {
            return null;
        }
        if (type == ExporterType.OTLP_HTTP) {
            String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
            return base + "/v1/" + signal.pipelineName();
        }
        return endpoint;
    }

    public enum ExporterType {
        OTLP("otlp"),
        OTLP_HTTP("otlphttp"),
        LOGGING("logging");

        private final String configName;

        ExporterType(String configName) {
            this.configName = configName;
        }

        @JsonValue
        public String configName() {
            return configName;
        }

        @JsonCreator
        public static ExporterType fromConfigName(String name) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(type -> type.configName.equals(normalized))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown exporter type '" + name
                            + "', expected one of otlp, otlphttp, logging"));
        }
    }

    /**
     * Exponential backoff applied to retryable failures.
     *
     * @param maxAttempts total number of attempts, the first one included
     */
    public record RetryConfig(Boolean enabled,
                              Duration initialInterval,
                              Duration maxInterval,
                              Double multiplier,
                              Integer maxAttempts) {
        public RetryConfig {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            initialInterval = initialInterval == null ? Duration.ofSeconds(1) : initialInterval;
            maxInterval = maxInterval == null ? Duration.ofSeconds(30) : maxInterval;
            multiplier = multiplier == null ? 2.0 : multiplier;
            maxAttempts = maxAttempts == null ? 5 : maxAttempts;
        }
    }
}
