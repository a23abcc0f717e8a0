package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.CollectorContext;
import com.example.opentelemetry.pipeline.TestTelemetry;
import com.example.opentelemetry.pipeline.model.AnyValues;
import com.example.opentelemetry.pipeline.model.Batch;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.example.opentelemetry.pipeline.TestTelemetry.log;
import static com.example.opentelemetry.pipeline.TestTelemetry.metric;
import static com.example.opentelemetry.pipeline.TestTelemetry.span;
import static org.assertj.core.api.Assertions.assertThat;

public class PipelineWorkerTest {

    private final CollectorContext context = TestTelemetry.context(TestTelemetry.singleSinkConfig(100, "1m"));
    private final List<Batch> batches = new CopyOnWriteArrayList<>();
    private final BatchProcessor batchProcessor = new BatchProcessor(context, batches::add);
    private final IngressQueue queue = new IngressQueue(10);
    private final RecordProcessor enrichment = new ResourceEnrichmentProcessor(
            TelemetryResource.builder().put("host.name", "collector-1").build());

    @AfterEach
    public void tearDown() throws Exception {
        batchProcessor.shutdown(Duration.ofSeconds(1));
    }

    @Test
    public void testDrainProcessesEveryQueuedRequest() throws Exception {
        PipelineWorker worker = new PipelineWorker(queue, List.of(enrichment), batchProcessor);
        queue.offer(List.of(metric("a", 1), metric("b", 2)), Duration.ZERO);
        queue.offer(List.of(log("c")), Duration.ZERO);
        queue.offer(List.of(span("d")), Duration.ZERO);

        worker.start();
        assertThat(worker.drain(Duration.ofSeconds(5))).isTrue();
        batchProcessor.flushAll();

        List<TelemetryRecord> records = batches.stream().flatMap(batch -> batch.records().stream()).toList();
        assertThat(records).hasSize(4);
        assertThat(records).allSatisfy(record ->
                assertThat(record.attributes()).containsEntry("host.name", AnyValues.of("collector-1")));
        assertThat(queue.isClosed()).isTrue();
    }

    @Test
    public void testFailingProcessorDropsOnlyThatRecord() {
        RecordProcessor rejectLogs = record -> {
            if (record.signalType() == SignalType.LOG) {
                throw new IllegalStateException("boom");
            }
        };
        PipelineWorker worker = new PipelineWorker(queue, List.of(rejectLogs, enrichment), batchProcessor);

        worker.handle(List.of(metric("a", 1), log("b"), metric("c", 3)));
        batchProcessor.flushAll();

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).size()).isEqualTo(2);
    }

    @Test
    public void testDrainOfIdleWorkerReturnsQuickly() throws Exception {
        PipelineWorker worker = new PipelineWorker(queue, List.of(), batchProcessor);
        worker.start();

        long start = System.nanoTime();
        assertThat(worker.drain(Duration.ofSeconds(5))).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    public void testRunsOnNamedDaemonThread() {
        PipelineWorker worker = new PipelineWorker(queue, List.of(), batchProcessor);

        assertThat(worker.thread().getName()).isEqualTo("pipeline-worker");
        assertThat(worker.thread().isDaemon()).isTrue();
        assertThat(worker.thread().getUncaughtExceptionHandler()).isNotSameAs(worker.thread().getThreadGroup());
    }

    @Test
    public void testRecordsHandledAfterBatcherShutdownAreNotBatched() throws Exception {
        PipelineWorker worker = new PipelineWorker(queue, List.of(enrichment), batchProcessor);
        batchProcessor.shutdown(Duration.ofSeconds(1));

        worker.handle(List.of(metric("late", 1)));
        batchProcessor.flushAll();

        assertThat(batches).isEmpty();
    }
}
