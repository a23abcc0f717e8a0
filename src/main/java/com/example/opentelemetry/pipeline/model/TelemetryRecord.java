package com.example.opentelemetry.pipeline.model;

import io.opentelemetry.proto.common.v1.AnyValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single unit of telemetry flowing through the pipeline: one metric data point, one log record or one span.
 * <p>
 * The signal type and timestamps are fixed at construction. Attributes can only grow: {@link #appendAttribute}
 * never replaces a value that is already present.
 * <p>
 * Records are not thread-safe. A record is mutated by the pipeline worker only, before it is handed to the
 * exporters as part of an immutable {@link Batch}.
 */
public abstract class TelemetryRecord {

    private final SignalType signalType;
    private final long timestampUnixNano;
    private final long receivedNanoTime;
    private final TelemetryResource resource;
    private final InstrumentationScopeInfo scope;
    private final Map<String, AnyValue> attributes;
    private final Map<String, AnyValue> attributesView;

    protected TelemetryRecord(SignalType signalType,
                              long timestampUnixNano,
                              long receivedNanoTime,
                              TelemetryResource resource,
                              InstrumentationScopeInfo scope,
                              Map<String, AnyValue> attributes) {
        this.signalType = Objects.requireNonNull(signalType, "signalType");
        this.timestampUnixNano = timestampUnixNano;
        this.receivedNanoTime = receivedNanoTime;
        this.resource = Objects.requireNonNull(resource, "resource");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.attributes = new LinkedHashMap<>(attributes);
        this.attributesView = Collections.unmodifiableMap(this.attributes);
    }

    public final SignalType signalType() {
        return signalType;
    }

    public final long timestampUnixNano() {
        return timestampUnixNano;
    }

    /**
     * Value of {@link System#nanoTime()} when the record entered the collector. Used for batch ageing.
     */
    public final long receivedNanoTime() {
        return receivedNanoTime;
    }

    public final TelemetryResource resource() {
        return resource;
    }

    public final InstrumentationScopeInfo scope() {
        return scope;
    }

    public final Map<String, AnyValue> attributes() {
        return attributesView;
    }

    /**
     * Adds an attribute unless the record already carries the key.
     *
     * @return {@code true} if the attribute was added
     */
    public final boolean appendAttribute(String key, AnyValue value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return attributes.putIfAbsent(key, value) == null;
    }
}
