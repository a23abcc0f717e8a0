package com.example.opentelemetry.pipeline.otlp;

import com.example.opentelemetry.pipeline.TestTelemetry;
import com.example.opentelemetry.pipeline.model.AnyValues;
import com.example.opentelemetry.pipeline.model.MetricKind;
import com.example.opentelemetry.pipeline.model.MetricRecord;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import com.google.protobuf.ByteString;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.common.v1.InstrumentationScope;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.metrics.v1.AggregationTemporality;
import io.opentelemetry.proto.metrics.v1.Gauge;
import io.opentelemetry.proto.metrics.v1.Histogram;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.metrics.v1.Sum;
import io.opentelemetry.proto.resource.v1.Resource;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OtlpDecoderTest {

    private static final long T0 = 1_700_000_000_000_000_000L;

    private final TelemetryResource localResource = TelemetryResource.builder()
            .put("host.name", "collector-1")
            .put("service.name", "collector")
            .build();
    private final OtlpDecoder decoder = new OtlpDecoder(localResource);

    private static KeyValue attribute(String key, String value) {
        return KeyValue.newBuilder().setKey(key).setValue(AnyValues.of(value)).build();
    }

    private static Resource resource(String serviceName) {
        return Resource.newBuilder().addAttributes(attribute("service.name", serviceName)).build();
    }

    private static ExportMetricsServiceRequest sampleMetrics() {
        Metric requests = Metric.newBuilder()
                .setName("http.server.requests")
                .setUnit("{request}")
                .setSum(Sum.newBuilder()
                        .setAggregationTemporality(AggregationTemporality.AGGREGATION_TEMPORALITY_CUMULATIVE)
                        .setIsMonotonic(true)
                        .addDataPoints(NumberDataPoint.newBuilder().setTimeUnixNano(T0).setAsInt(10)
                                .addAttributes(attribute("http.route", "/cart")))
                        .addDataPoints(NumberDataPoint.newBuilder().setTimeUnixNano(T0).setAsInt(3)
                                .addAttributes(attribute("http.route", "/checkout"))))
                .build();
        Metric latency = Metric.newBuilder()
                .setName("http.server.duration")
                .setUnit("ms")
                .setHistogram(Histogram.newBuilder()
                        .setAggregationTemporality(AggregationTemporality.AGGREGATION_TEMPORALITY_DELTA)
                        .addDataPoints(HistogramDataPoint.newBuilder().setTimeUnixNano(T0).setCount(2).setSum(30)
                                .addExplicitBounds(10).addBucketCounts(0).addBucketCounts(2)))
                .build();
        Metric temperature = Metric.newBuilder()
                .setName("room.temperature")
                .setGauge(Gauge.newBuilder().addDataPoints(NumberDataPoint.newBuilder().setTimeUnixNano(T0).setAsDouble(21.5)))
                .build();
        return ExportMetricsServiceRequest.newBuilder()
                .addResourceMetrics(ResourceMetrics.newBuilder()
                        .setResource(resource("checkout"))
                        .addScopeMetrics(ScopeMetrics.newBuilder()
                                .setScope(InstrumentationScope.newBuilder().setName("io.opentelemetry.jetty").setVersion("1.0"))
                                .addMetrics(requests)
                                .addMetrics(latency)))
                .addResourceMetrics(ResourceMetrics.newBuilder()
                        .setResource(resource("thermostat"))
                        .addScopeMetrics(ScopeMetrics.newBuilder()
                                .setScope(InstrumentationScope.newBuilder().setName("sensors"))
                                .setSchemaUrl("https://opentelemetry.io/schemas/1.21.0")
                                .addMetrics(temperature)))
                .build();
    }

    @Test
    public void testDecodesOneRecordPerDataPoint() throws Exception {
        List<TelemetryRecord> records = decoder.decodeMetrics(sampleMetrics(), 42L);

        assertThat(records).hasSize(4);
        assertThat(records).allSatisfy(record -> {
            assertThat(record.signalType()).isEqualTo(SignalType.METRIC);
            assertThat(record.receivedNanoTime()).isEqualTo(42L);
            assertThat(record.timestampUnixNano()).isEqualTo(T0);
        });
        MetricRecord first = (MetricRecord) records.get(0);
        assertThat(first.descriptor().kind()).isEqualTo(MetricKind.SUM);
        assertThat(first.descriptor().monotonic()).isTrue();
        assertThat(first.attributes()).containsEntry("http.route", AnyValues.of("/cart"));
        assertThat(((MetricRecord) records.get(2)).descriptor().kind()).isEqualTo(MetricKind.HISTOGRAM);
        assertThat(records.get(3).scope().schemaUrl()).isEqualTo("https://opentelemetry.io/schemas/1.21.0");
    }

    @Test
    public void testLocalResourceFillsMissingAttributesOnly() throws Exception {
        TelemetryRecord record = decoder.decodeMetrics(sampleMetrics(), 0).get(0);

        assertThat(record.resource().getString("service.name")).isEqualTo("checkout");
        assertThat(record.resource().getString("host.name")).isEqualTo("collector-1");
    }

    @Test
    public void testRecordsWithoutResourceGetTheLocalOne() throws Exception {
        ExportLogsServiceRequest request = ExportLogsServiceRequest.newBuilder()
                .addResourceLogs(ResourceLogs.newBuilder()
                        .addScopeLogs(ScopeLogs.newBuilder()
                                .addLogRecords(LogRecord.newBuilder().setObservedTimeUnixNano(T0).setBody(AnyValues.of("hi")))))
                .build();

        TelemetryRecord record = decoder.decodeLogs(request, 0).get(0);

        assertThat(record.resource()).isEqualTo(localResource);
        assertThat(record.timestampUnixNano()).isEqualTo(T0);
    }

    @Test
    public void testEncodingDecodedRecordsRestoresTheRequest() throws Exception {
        ExportMetricsServiceRequest original = sampleMetrics();

        ExportMetricsServiceRequest encoded = OtlpEncoder.encodeMetrics(new OtlpDecoder(TelemetryResource.EMPTY).decodeMetrics(original, 0));

        assertThat(encoded).isEqualTo(original);
    }

    @Test
    public void testRejectsMetricWithoutName() {
        ExportMetricsServiceRequest request = ExportMetricsServiceRequest.newBuilder()
                .addResourceMetrics(ResourceMetrics.newBuilder()
                        .addScopeMetrics(ScopeMetrics.newBuilder()
                                .addMetrics(Metric.newBuilder().setGauge(Gauge.getDefaultInstance()))))
                .build();

        assertThatThrownBy(() -> decoder.decodeMetrics(request, 0))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("name");
    }

    @Test
    public void testRejectsMetricWithoutData() {
        ExportMetricsServiceRequest request = ExportMetricsServiceRequest.newBuilder()
                .addResourceMetrics(ResourceMetrics.newBuilder()
                        .addScopeMetrics(ScopeMetrics.newBuilder()
                                .addMetrics(Metric.newBuilder().setName("empty"))))
                .build();

        assertThatThrownBy(() -> decoder.decodeMetrics(request, 0))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("\"empty\" has no data");
    }

    @Test
    public void testRejectsSpanIdentifiersOfWrongLength() {
        assertThatThrownBy(() -> decoder.decodeTraces(spans(ByteString.EMPTY, TestTelemetry.randomId(8)), 0))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("trace_id must be 16 bytes long, got 0");
        assertThatThrownBy(() -> decoder.decodeTraces(spans(TestTelemetry.randomId(16), TestTelemetry.randomId(9)), 0))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("span_id");
    }

    @Test
    public void testLogIdentifiersAreOptional() throws Exception {
        ExportLogsServiceRequest withoutIds = logs(ByteString.EMPTY);
        ExportLogsServiceRequest withBadTraceId = logs(TestTelemetry.randomId(5));

        assertThat(decoder.decodeLogs(withoutIds, 0)).hasSize(1);
        assertThatThrownBy(() -> decoder.decodeLogs(withBadTraceId, 0))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("trace_id must be empty or 16 bytes long");
    }

    private static ExportTraceServiceRequest spans(ByteString traceId, ByteString spanId) {
        return ExportTraceServiceRequest.newBuilder()
                .addResourceSpans(ResourceSpans.newBuilder()
                        .addScopeSpans(ScopeSpans.newBuilder()
                                .addSpans(Span.newBuilder().setName("GET /").setTraceId(traceId).setSpanId(spanId))))
                .build();
    }

    private static ExportLogsServiceRequest logs(ByteString traceId) {
        return ExportLogsServiceRequest.newBuilder()
                .addResourceLogs(ResourceLogs.newBuilder()
                        .addScopeLogs(ScopeLogs.newBuilder()
                                .addLogRecords(LogRecord.newBuilder().setTimeUnixNano(T0).setTraceId(traceId))))
                .build();
    }
}
