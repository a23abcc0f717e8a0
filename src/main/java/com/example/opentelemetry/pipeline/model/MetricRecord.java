package com.example.opentelemetry.pipeline.model;

import com.google.protobuf.Message;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.metrics.v1.ExponentialHistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.SummaryDataPoint;

import java.util.Map;
import java.util.Objects;

/**
 * One data point of one metric series. The point is kept in its OTLP form, without its attributes: those
 * live in {@link #attributes()} so that pipeline stages can append to them.
 */
public final class MetricRecord extends TelemetryRecord {

    private final MetricDescriptor descriptor;
    private final Message dataPoint;

    public MetricRecord(MetricDescriptor descriptor,
                        Message dataPoint,
                        long timestampUnixNano,
                        long receivedNanoTime,
                        TelemetryResource resource,
                        InstrumentationScopeInfo scope,
                        Map<String, AnyValue> attributes) {
        super(SignalType.METRIC, timestampUnixNano, receivedNanoTime, resource, scope, attributes);
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.dataPoint = Objects.requireNonNull(dataPoint, "dataPoint");
        checkPointType(descriptor.kind(), dataPoint);
    }

    public static MetricRecord ofDouble(MetricDescriptor descriptor,
                                        double value,
                                        long startTimeUnixNano,
                                        long timeUnixNano,
                                        TelemetryResource resource,
                                        InstrumentationScopeInfo scope,
                                        Map<String, AnyValue> attributes) {
        NumberDataPoint point = NumberDataPoint.newBuilder()
                .setStartTimeUnixNano(startTimeUnixNano)
                .setTimeUnixNano(timeUnixNano)
                .setAsDouble(value)
                .build();
        return new MetricRecord(descriptor, point, timeUnixNano, System.nanoTime(), resource, scope, attributes);
    }

    public static MetricRecord ofLong(MetricDescriptor descriptor,
                                      long value,
                                      long startTimeUnixNano,
                                      long timeUnixNano,
                                      TelemetryResource resource,
                                      InstrumentationScopeInfo scope,
                                      Map<String, AnyValue> attributes) {
        NumberDataPoint point = NumberDataPoint.newBuilder()
                .setStartTimeUnixNano(startTimeUnixNano)
                .setTimeUnixNano(timeUnixNano)
                .setAsInt(value)
                .build();
        return new MetricRecord(descriptor, point, timeUnixNano, System.nanoTime(), resource, scope, attributes);
    }

    public MetricDescriptor descriptor() {
        return descriptor;
    }

    /**
     * The OTLP data point, stripped of its attributes. Its concrete type follows {@link MetricDescriptor#kind()}.
     */
    public Message dataPoint() {
        return dataPoint;
    }

    private static void checkPointType(MetricKind kind, Message dataPoint) {
        Class<? extends Message> expected = switch (kind) {
            case GAUGE, SUM -> NumberDataPoint.class;
            case HISTOGRAM -> HistogramDataPoint.class;
            case EXPONENTIAL_HISTOGRAM -> ExponentialHistogramDataPoint.class;
            case SUMMARY -> SummaryDataPoint.class;
        };
        if (!expected.isInstance(dataPoint)) {
            throw new IllegalArgumentException("Metric of kind " + kind + " cannot hold a " + dataPoint.getClass().getSimpleName());
        }
    }

    @Override
    public String toString() {
        return "MetricRecord{name=" + descriptor.name() + ", kind=" + descriptor.kind() + ", attributes=" + attributes().keySet() + "}";
    }
}
