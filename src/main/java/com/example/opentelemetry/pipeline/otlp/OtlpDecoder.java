package com.example.opentelemetry.pipeline.otlp;

import com.example.opentelemetry.pipeline.model.AnyValues;
import com.example.opentelemetry.pipeline.model.InstrumentationScopeInfo;
import com.example.opentelemetry.pipeline.model.LogRecord;
import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import com.example.opentelemetry.pipeline.model.MetricKind;
import com.example.opentelemetry.pipeline.model.MetricRecord;
import com.example.opentelemetry.pipeline.model.SpanRecord;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import com.google.protobuf.ByteString;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.metrics.v1.ExponentialHistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.metrics.v1.SummaryDataPoint;
import io.opentelemetry.proto.resource.v1.Resource;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns OTLP export requests into {@link TelemetryRecord}s.
 * <p>
 * Every record is tagged with the resource the caller declared, completed with the attributes of the local
 * resource for the keys the caller did not set. Decoding is all or nothing: a single invalid item fails the
 * whole request with a {@link MalformedPayloadException}.
 */
public class OtlpDecoder {

    private static final int TRACE_ID_LENGTH = 16;
    private static final int SPAN_ID_LENGTH = 8;

    private final TelemetryResource localResource;

    public OtlpDecoder(TelemetryResource localResource) {
        this.localResource = localResource;
    }

    public List<TelemetryRecord> decodeMetrics(ExportMetricsServiceRequest request, long receivedNanoTime) throws MalformedPayloadException {
        List<TelemetryRecord> records = new ArrayList<>();
        for (ResourceMetrics resourceMetrics : request.getResourceMetricsList()) {
            TelemetryResource resource = resolve(resourceMetrics.getResource());
            for (ScopeMetrics scopeMetrics : resourceMetrics.getScopeMetricsList()) {
                InstrumentationScopeInfo scope = new InstrumentationScopeInfo(scopeMetrics.getScope(), scopeMetrics.getSchemaUrl());
                for (Metric metric : scopeMetrics.getMetricsList()) {
                    decodeMetric(metric, resource, scope, receivedNanoTime, records);
                }
            }
        }
        return records;
    }

    public List<TelemetryRecord> decodeLogs(ExportLogsServiceRequest request, long receivedNanoTime) throws MalformedPayloadException {
        List<TelemetryRecord> records = new ArrayList<>();
        for (ResourceLogs resourceLogs : request.getResourceLogsList()) {
            TelemetryResource resource = resolve(resourceLogs.getResource());
            for (ScopeLogs scopeLogs : resourceLogs.getScopeLogsList()) {
                InstrumentationScopeInfo scope = new InstrumentationScopeInfo(scopeLogs.getScope(), scopeLogs.getSchemaUrl());
                for (io.opentelemetry.proto.logs.v1.LogRecord logRecord : scopeLogs.getLogRecordsList()) {
                    checkOptionalId("log record trace_id", logRecord.getTraceId(), TRACE_ID_LENGTH);
                    checkOptionalId("log record span_id", logRecord.getSpanId(), SPAN_ID_LENGTH);
                    records.add(new LogRecord(
                            logRecord.toBuilder().clearAttributes().build(),
                            receivedNanoTime,
                            resource,
                            scope,
                            AnyValues.toMap(logRecord.getAttributesList())));
                }
            }
        }
        return records;
    }

    public List<TelemetryRecord> decodeTraces(ExportTraceServiceRequest request, long receivedNanoTime) throws MalformedPayloadException {
        List<TelemetryRecord> records = new ArrayList<>();
        for (ResourceSpans resourceSpans : request.getResourceSpansList()) {
            TelemetryResource resource = resolve(resourceSpans.getResource());
            for (ScopeSpans scopeSpans : resourceSpans.getScopeSpansList()) {
                InstrumentationScopeInfo scope = new InstrumentationScopeInfo(scopeSpans.getScope(), scopeSpans.getSchemaUrl());
                for (Span span : scopeSpans.getSpansList()) {
                    checkRequiredId("span \"" + span.getName() + "\" trace_id", span.getTraceId(), TRACE_ID_LENGTH);
                    checkRequiredId("span \"" + span.getName() + "\" span_id", span.getSpanId(), SPAN_ID_LENGTH);
                    checkOptionalId("span \"" + span.getName() + "\" parent_span_id", span.getParentSpanId(), SPAN_ID_LENGTH);
                    records.add(new SpanRecord(
                            span.toBuilder().clearAttributes().build(),
                            receivedNanoTime,
                            resource,
                            scope,
                            AnyValues.toMap(span.getAttributesList())));
                }
            }
        }
        return records;
    }

    private TelemetryResource resolve(Resource resource) {
        return TelemetryResource.fromProto(resource).withDefaults(localResource);
    }

    private static void decodeMetric(Metric metric,
                                     TelemetryResource resource,
                                     InstrumentationScopeInfo scope,
                                     long receivedNanoTime,
                                     List<TelemetryRecord> records) throws MalformedPayloadException {
        if (metric.getName().isEmpty()) {
            throw new MalformedPayloadException("metric name must not be empty");
        }
        switch (metric.getDataCase()) {
            case GAUGE -> {
                MetricDescriptor descriptor = descriptor(metric, MetricKind.GAUGE, null, false);
                for (NumberDataPoint point : metric.getGauge().getDataPointsList()) {
                    records.add(new MetricRecord(descriptor, point.toBuilder().clearAttributes().build(), point.getTimeUnixNano(),
                            receivedNanoTime, resource, scope, AnyValues.toMap(point.getAttributesList())));
                }
            }
            case SUM -> {
                MetricDescriptor descriptor = descriptor(metric, MetricKind.SUM,
                        metric.getSum().getAggregationTemporality(), metric.getSum().getIsMonotonic());
                for (NumberDataPoint point : metric.getSum().getDataPointsList()) {
                    records.add(new MetricRecord(descriptor, point.toBuilder().clearAttributes().build(), point.getTimeUnixNano(),
                            receivedNanoTime, resource, scope, AnyValues.toMap(point.getAttributesList())));
                }
            }
            case HISTOGRAM -> {
                MetricDescriptor descriptor = descriptor(metric, MetricKind.HISTOGRAM,
                        metric.getHistogram().getAggregationTemporality(), false);
                for (HistogramDataPoint point : metric.getHistogram().getDataPointsList()) {
                    records.add(new MetricRecord(descriptor, point.toBuilder().clearAttributes().build(), point.getTimeUnixNano(),
                            receivedNanoTime, resource, scope, AnyValues.toMap(point.getAttributesList())));
                }
            }
            case EXPONENTIAL_HISTOGRAM -> {
                MetricDescriptor descriptor = descriptor(metric, MetricKind.EXPONENTIAL_HISTOGRAM,
                        metric.getExponentialHistogram().getAggregationTemporality(), false);
                for (ExponentialHistogramDataPoint point : metric.getExponentialHistogram().getDataPointsList()) {
                    records.add(new MetricRecord(descriptor, point.toBuilder().clearAttributes().build(), point.getTimeUnixNano(),
                            receivedNanoTime, resource, scope, AnyValues.toMap(point.getAttributesList())));
                }
            }
            case SUMMARY -> {
                MetricDescriptor descriptor = descriptor(metric, MetricKind.SUMMARY, null, false);
                for (SummaryDataPoint point : metric.getSummary().getDataPointsList()) {
                    records.add(new MetricRecord(descriptor, point.toBuilder().clearAttributes().build(), point.getTimeUnixNano(),
                            receivedNanoTime, resource, scope, AnyValues.toMap(point.getAttributesList())));
                }
            }
            case DATA_NOT_SET -> throw new MalformedPayloadException("metric \"" + metric.getName() + "\" has no data");
        }
    }

    private static MetricDescriptor descriptor(Metric metric, MetricKind kind,
                                               io.opentelemetry.proto.metrics.v1.AggregationTemporality temporality,
                                               boolean monotonic) {
        return new MetricDescriptor(metric.getName(), metric.getDescription(), metric.getUnit(), kind, temporality, monotonic);
    }

    private static void checkRequiredId(String field, ByteString id, int length) throws MalformedPayloadException {
        if (id.size() != length) {
            throw new MalformedPayloadException(field + " must be " + length + " bytes long, got " + id.size());
        }
    }

    private static void checkOptionalId(String field, ByteString id, int length) throws MalformedPayloadException {
        if (!id.isEmpty() && id.size() != length) {
            throw new MalformedPayloadException(field + " must be empty or " + length + " bytes long, got " + id.size());
        }
    }
}
