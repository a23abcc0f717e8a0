package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.CollectorContext;
import com.example.opentelemetry.pipeline.TestTelemetry;
import com.example.opentelemetry.pipeline.model.Batch;
import com.example.opentelemetry.pipeline.model.SignalType;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.example.opentelemetry.pipeline.TestTelemetry.log;
import static com.example.opentelemetry.pipeline.TestTelemetry.metric;
import static com.example.opentelemetry.pipeline.TestTelemetry.span;
import static org.assertj.core.api.Assertions.assertThat;

public class BatchProcessorTest {

    private static final String CONFIG = """
            receivers:
              otlp:
                grpc:
                  endpoint: 127.0.0.1:0
            processors:
              batch:
                sendBatchSize: 4
                timeout: 1m
            exporters:
              store:
                type: logging
              debug:
                type: logging
            service:
              pipelines:
                metrics:
                  exporters: [store]
                logs:
                  exporters: [store]
                traces:
                  exporters: [store, debug]
            extensions:
              healthCheck:
                enabled: false
            """;

    private final InMemoryMetricReader metricReader = InMemoryMetricReader.create();
    private final SdkMeterProvider meterProvider = SdkMeterProvider.builder().registerMetricReader(metricReader).build();
    private final List<Batch> batches = new CopyOnWriteArrayList<>();
    private BatchProcessor processor;

    @AfterEach
    public void tearDown() throws Exception {
        if (processor != null) {
            processor.shutdown(Duration.ofSeconds(1));
        }
        meterProvider.close();
    }

    private BatchProcessor newProcessor(String yaml) {
        CollectorContext context = TestTelemetry.context(yaml, meterProvider.get(CollectorContext.INSTRUMENTATION_NAME));
        processor = new BatchProcessor(context, batches::add);
        return processor;
    }

    @Test
    public void testSignalsWithSameDestinationsShareBatches() {
        BatchProcessor processor = newProcessor(CONFIG);

        processor.process(metric("cpu", 1));
        processor.process(log("started"));
        processor.process(metric("mem", 2));
        processor.process(log("ready"));

        assertThat(processor.accumulators()).hasSize(2);
        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).destinations()).containsExactly("store");
        assertThat(batches.get(0).countsBySignal())
                .containsEntry(SignalType.METRIC, 2)
                .containsEntry(SignalType.LOG, 2);
    }

    @Test
    public void testSpansAreBatchedForTheirOwnDestinations() throws Exception {
        BatchProcessor processor = newProcessor(CONFIG);

        processor.process(span("GET /"));
        processor.process(metric("cpu", 1));
        processor.shutdown(Duration.ofSeconds(1));

        assertThat(batches).hasSize(2);
        assertThat(batches).extracting(Batch::destinations)
                .containsExactlyInAnyOrder(Set.of("store"), Set.of("store", "debug"));
    }

    @Test
    public void testProducesCeilingOfRecordsOverBatchSizeBatches() throws Exception {
        BatchProcessor processor = newProcessor(CONFIG);

        for (int i = 0; i < 10; i++) {
            processor.process(metric("m", i));
        }
        processor.flushAll();

        assertThat(batches).extracting(Batch::size).containsExactly(4, 4, 2);
        assertThat(longSum("processor.batch.batches")).isEqualTo(3);
    }

    @Test
    public void testDropsSignalWithoutPipeline() {
        BatchProcessor processor = newProcessor(CONFIG.replace("""
                    logs:
                      exporters: [store]
                """, ""));

        processor.process(log("nowhere to go"));
        processor.flushAll();

        assertThat(batches).isEmpty();
        assertThat(longSum("processor.batch.dropped_records")).isEqualTo(1);
    }

    @Test
    public void testRecordsAfterShutdownAreCountedAsDropped() throws Exception {
        BatchProcessor processor = newProcessor(CONFIG);
        processor.process(metric("before", 1));
        processor.shutdown(Duration.ofSeconds(1));

        processor.process(metric("late", 2));
        processor.process(log("late"));
        processor.flushAll();

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).size()).isEqualTo(1);
        assertThat(longSum("processor.batch.dropped_records")).isEqualTo(2);
        assertThat(droppedFor("shutdown")).isEqualTo(2);
    }

    private long droppedFor(String reason) {
        return metricReader.collectAllMetrics().stream()
                .filter(metric -> metric.getName().equals("processor.batch.dropped_records"))
                .map(MetricData::getLongSumData)
                .flatMap(data -> data.getPoints().stream())
                .filter(point -> reason.equals(point.getAttributes().get(BatchProcessor.REASON)))
                .mapToLong(LongPointData::getValue)
                .sum();
    }

    private long longSum(String name) {
        return metricReader.collectAllMetrics().stream()
                .filter(metric -> metric.getName().equals(name))
                .map(MetricData::getLongSumData)
                .flatMap(data -> data.getPoints().stream())
                .mapToLong(LongPointData::getValue)
                .sum();
    }
}
