package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.AnyValues;
import com.example.opentelemetry.pipeline.model.InstrumentationScopeInfo;
import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import com.example.opentelemetry.pipeline.model.MetricRecord;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.proto.common.v1.AnyValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the points produced by one scraper during one tick. Every point shares the tick timestamp, the
 * collector resource and the scraper's instrumentation scope. Cumulative sums start at host boot.
 */
public final class MetricPoints {

    private final TelemetryResource resource;
    private final InstrumentationScopeInfo scope;
    private final long startTimeUnixNano;
    private final long timeUnixNano;
    private final List<TelemetryRecord> records = new ArrayList<>();

    public MetricPoints(TelemetryResource resource, InstrumentationScopeInfo scope, long startTimeUnixNano, long timeUnixNano) {
        this.resource = resource;
        this.scope = scope;
        this.startTimeUnixNano = startTimeUnixNano;
        this.timeUnixNano = timeUnixNano;
    }

    public void gauge(MetricDescriptor descriptor, double value, Map<String, String> attributes) {
        records.add(MetricRecord.ofDouble(descriptor, value, 0, timeUnixNano, resource, scope, toAnyValues(attributes)));
    }

    public void gauge(MetricDescriptor descriptor, long value, Map<String, String> attributes) {
        records.add(MetricRecord.ofLong(descriptor, value, 0, timeUnixNano, resource, scope, toAnyValues(attributes)));
    }

    public void sum(MetricDescriptor descriptor, double value, Map<String, String> attributes) {
        records.add(MetricRecord.ofDouble(descriptor, value, startTimeUnixNano, timeUnixNano, resource, scope, toAnyValues(attributes)));
    }

    public void sum(MetricDescriptor descriptor, long value, Map<String, String> attributes) {
        records.add(MetricRecord.ofLong(descriptor, value, startTimeUnixNano, timeUnixNano, resource, scope, toAnyValues(attributes)));
    }

    public List<TelemetryRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    private static Map<String, AnyValue> toAnyValues(Map<String, String> attributes) {
        Map<String, AnyValue> values = new LinkedHashMap<>();
        attributes.forEach((key, value) -> values.put(key, AnyValues.of(value)));
        return values;
    }
}
