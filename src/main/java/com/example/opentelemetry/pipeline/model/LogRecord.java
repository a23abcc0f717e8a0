package com.example.opentelemetry.pipeline.model;

import io.opentelemetry.proto.common.v1.AnyValue;

import java.util.Map;
import java.util.Objects;

public final class LogRecord extends TelemetryRecord {

    private final io.opentelemetry.proto.logs.v1.LogRecord payload;

    public LogRecord(io.opentelemetry.proto.logs.v1.LogRecord payload,
                     long receivedNanoTime,
                     TelemetryResource resource,
                     InstrumentationScopeInfo scope,
                     Map<String, AnyValue> attributes) {
        super(SignalType.LOG, eventTime(payload), receivedNanoTime, resource, scope, attributes);
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    private static long eventTime(io.opentelemetry.proto.logs.v1.LogRecord payload) {
        return payload.getTimeUnixNano() != 0 ? payload.getTimeUnixNano() : payload.getObservedTimeUnixNano();
    }

    public io.opentelemetry.proto.logs.v1.LogRecord payload() {
        return payload;
    }

    @Override
    public String toString() {
        return "LogRecord{severity=" + payload.getSeverityText() + ", attributes=" + attributes().keySet() + "}";
    }
}
