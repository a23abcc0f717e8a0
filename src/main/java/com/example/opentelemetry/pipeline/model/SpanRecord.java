package com.example.opentelemetry.pipeline.model;

import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.trace.v1.Span;

import java.util.Map;
import java.util.Objects;

public final class SpanRecord extends TelemetryRecord {

    private final Span payload;

    public SpanRecord(Span payload,
                      long receivedNanoTime,
                      TelemetryResource resource,
                      InstrumentationScopeInfo scope,
                      Map<String, AnyValue> attributes) {
        super(SignalType.SPAN, payload.getStartTimeUnixNano(), receivedNanoTime, resource, scope, attributes);
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public Span payload() {
        return payload;
    }

    @Override
    public String toString() {
        return "SpanRecord{name=\"" + payload.getName() + "\", kind=" + payload.getKind() + ", attributes=" + attributes().keySet() + "}";
    }
}
