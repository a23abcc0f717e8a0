package com.example.opentelemetry.pipeline.otlp;

import com.example.opentelemetry.pipeline.model.AnyValues;
import com.example.opentelemetry.pipeline.model.InstrumentationScopeInfo;
import com.example.opentelemetry.pipeline.model.LogRecord;
import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import com.example.opentelemetry.pipeline.model.MetricRecord;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.SpanRecord;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.metrics.v1.ExponentialHistogram;
import io.opentelemetry.proto.metrics.v1.ExponentialHistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Gauge;
import io.opentelemetry.proto.metrics.v1.Histogram;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.metrics.v1.Sum;
import io.opentelemetry.proto.metrics.v1.Summary;
import io.opentelemetry.proto.metrics.v1.SummaryDataPoint;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds OTLP export requests from records. Records sharing a resource, a scope and, for metrics, a metric
 * descriptor are regrouped under a single envelope, keeping their relative order. Record attributes are written
 * back onto the data point, log record or span.
 */
public final class OtlpEncoder {

    private OtlpEncoder() {
    }

    public static ExportMetricsServiceRequest encodeMetrics(List<? extends TelemetryRecord> records) {
        ExportMetricsServiceRequest.Builder request = ExportMetricsServiceRequest.newBuilder();
        group(records, SignalType.METRIC).forEach((resource, scopes) -> {
            ResourceMetrics.Builder resourceMetrics = ResourceMetrics.newBuilder().setResource(resource.toProto());
            scopes.forEach((scope, scopeRecords) -> {
                Map<MetricDescriptor, Metric.Builder> metrics = new LinkedHashMap<>();
                for (TelemetryRecord record : scopeRecords) {
                    MetricRecord metricRecord = (MetricRecord) record;
                    Metric.Builder metric = metrics.computeIfAbsent(metricRecord.descriptor(), OtlpEncoder::newMetric);
                    addPoint(metric, metricRecord);
                }
                ScopeMetrics.Builder scopeMetrics = ScopeMetrics.newBuilder()
                        .setScope(scope.scope())
                        .setSchemaUrl(scope.schemaUrl());
                metrics.values().forEach(scopeMetrics::addMetrics);
                resourceMetrics.addScopeMetrics(scopeMetrics);
            });
            request.addResourceMetrics(resourceMetrics);
        });
        return request.build();
    }

    public static ExportLogsServiceRequest encodeLogs(List<? extends TelemetryRecord> records) {
        ExportLogsServiceRequest.Builder request = ExportLogsServiceRequest.newBuilder();
        group(records, SignalType.LOG).forEach((resource, scopes) -> {
            ResourceLogs.Builder resourceLogs = ResourceLogs.newBuilder().setResource(resource.toProto());
            scopes.forEach((scope, scopeRecords) -> {
                ScopeLogs.Builder scopeLogs = ScopeLogs.newBuilder().setScope(scope.scope()).setSchemaUrl(scope.schemaUrl());
                for (TelemetryRecord record : scopeRecords) {
                    LogRecord logRecord = (LogRecord) record;
                    scopeLogs.addLogRecords(logRecord.payload().toBuilder().addAllAttributes(attributesOf(record)));
                }
                resourceLogs.addScopeLogs(scopeLogs);
            });
            request.addResourceLogs(resourceLogs);
        });
        return request.build();
    }

    public static ExportTraceServiceRequest encodeSpans(List<? extends TelemetryRecord> records) {
        ExportTraceServiceRequest.Builder request = ExportTraceServiceRequest.newBuilder();
        group(records, SignalType.SPAN).forEach((resource, scopes) -> {
            ResourceSpans.Builder resourceSpans = ResourceSpans.newBuilder().setResource(resource.toProto());
            scopes.forEach((scope, scopeRecords) -> {
                ScopeSpans.Builder scopeSpans = ScopeSpans.newBuilder().setScope(scope.scope()).setSchemaUrl(scope.schemaUrl());
                for (TelemetryRecord record : scopeRecords) {
                    SpanRecord spanRecord = (SpanRecord) record;
                    scopeSpans.addSpans(spanRecord.payload().toBuilder().addAllAttributes(attributesOf(record)));
                }
                resourceSpans.addScopeSpans(scopeSpans);
            });
            request.addResourceSpans(resourceSpans);
        });
        return request.build();
    }

    private static Map<TelemetryResource, Map<InstrumentationScopeInfo, List<TelemetryRecord>>> group(
            List<? extends TelemetryRecord> records, SignalType expected) {
        Map<TelemetryResource, Map<InstrumentationScopeInfo, List<TelemetryRecord>>> groups = new LinkedHashMap<>();
        for (TelemetryRecord record : records) {
            if (record.signalType() != expected) {
                throw new IllegalArgumentException("Cannot encode a " + record.signalType() + " record as " + expected);
            }
            groups.computeIfAbsent(record.resource(), resource -> new LinkedHashMap<>())
                    .computeIfAbsent(record.scope(), scope -> new ArrayList<>())
                    .add(record);
        }
        return groups;
    }

    private static Metric.Builder newMetric(MetricDescriptor descriptor) {
        Metric.Builder metric = Metric.newBuilder()
                .setName(descriptor.name())
                .setDescription(descriptor.description())
                .setUnit(descriptor.unit());
        switch (descriptor.kind()) {
            case GAUGE -> metric.setGauge(Gauge.getDefaultInstance());
            case SUM -> metric.setSum(Sum.newBuilder()
                    .setAggregationTemporality(descriptor.temporality())
                    .setIsMonotonic(descriptor.monotonic()));
            case HISTOGRAM -> metric.setHistogram(Histogram.newBuilder()
                    .setAggregationTemporality(descriptor.temporality()));
            case EXPONENTIAL_HISTOGRAM -> metric.setExponentialHistogram(ExponentialHistogram.newBuilder()
                    .setAggregationTemporality(descriptor.temporality()));
            case SUMMARY -> metric.setSummary(Summary.getDefaultInstance());
        }
        return metric;
    }

    private static void addPoint(Metric.Builder metric, MetricRecord record) {
        List<KeyValue> attributes = attributesOf(record);
        switch (record.descriptor().kind()) {
            case GAUGE -> metric.getGaugeBuilder()
                    .addDataPoints(((NumberDataPoint) record.dataPoint()).toBuilder().addAllAttributes(attributes));
            case SUM -> metric.getSumBuilder()
                    .addDataPoints(((NumberDataPoint) record.dataPoint()).toBuilder().addAllAttributes(attributes));
            case HISTOGRAM -> metric.getHistogramBuilder()
                    .addDataPoints(((HistogramDataPoint) record.dataPoint()).toBuilder().addAllAttributes(attributes));
            case EXPONENTIAL_HISTOGRAM -> metric.getExponentialHistogramBuilder()
                    .addDataPoints(((ExponentialHistogramDataPoint) record.dataPoint()).toBuilder().addAllAttributes(attributes));
            case SUMMARY -> metric.getSummaryBuilder()
                    .addDataPoints(((SummaryDataPoint) record.dataPoint()).toBuilder().addAllAttributes(attributes));
        }
    }

    private static List<KeyValue> attributesOf(TelemetryRecord record) {
        return AnyValues.toKeyValues(record.attributes());
    }
}
