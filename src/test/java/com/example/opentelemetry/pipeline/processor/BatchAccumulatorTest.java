package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.model.Batch;
import com.example.opentelemetry.pipeline.model.MetricRecord;
import com.example.opentelemetry.pipeline.processor.BatchAccumulator.FlushTrigger;
import com.example.opentelemetry.pipeline.util.Threads;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.example.opentelemetry.pipeline.TestTelemetry.log;
import static com.example.opentelemetry.pipeline.TestTelemetry.metric;
import static org.assertj.core.api.Assertions.assertThat;

public class BatchAccumulatorTest {

    private static final Logger logger = LoggerFactory.getLogger(BatchAccumulatorTest.class);

    private final ScheduledThreadPoolExecutor scheduler = Threads.newScheduler("test-flush", logger);
    private final BlockingQueue<Batch> batches = new LinkedBlockingQueue<>();
    private final List<FlushTrigger> triggers = Collections.synchronizedList(new ArrayList<>());

    @AfterEach
    public void tearDown() {
        scheduler.shutdownNow();
    }

    private BatchAccumulator accumulator(int sendBatchSize, Duration timeout) {
        return new BatchAccumulator(Set.of("sink"), sendBatchSize, timeout, scheduler, new AtomicLong(),
                batches::add, (batch, trigger) -> triggers.add(trigger));
    }

    @Test
    public void testCutsBatchesOfSendBatchSize() {
        BatchAccumulator accumulator = accumulator(10, Duration.ofMinutes(1));

        for (int i = 0; i < 25; i++) {
            accumulator.add(metric("m", i));
        }

        assertThat(batches).hasSize(2);
        assertThat(batches).allSatisfy(batch -> assertThat(batch.size()).isEqualTo(10));
        assertThat(accumulator.bufferedCount()).isEqualTo(5);

        accumulator.flush();

        assertThat(batches).hasSize(3);
        assertThat(triggers).containsExactly(FlushTrigger.SIZE, FlushTrigger.SIZE, FlushTrigger.SHUTDOWN);
    }

    @Test
    public void testKeepsArrivalOrderAcrossBatches() {
        BatchAccumulator accumulator = accumulator(3, Duration.ofMinutes(1));
        for (int i = 0; i < 7; i++) {
            accumulator.add(metric("m" + i, i));
        }
        accumulator.flush();

        List<String> names = new ArrayList<>();
        List<Long> sequences = new ArrayList<>();
        for (Batch batch : batches) {
            sequences.add(batch.sequence());
            batch.records().forEach(record -> names.add(((MetricRecord) record).descriptor().name()));
        }
        assertThat(names).containsExactly("m0", "m1", "m2", "m3", "m4", "m5", "m6");
        assertThat(sequences).isSorted().doesNotHaveDuplicates();
    }

    @Test
    public void testFlushesAfterTimeout() throws Exception {
        BatchAccumulator accumulator = accumulator(1000, Duration.ofMillis(200));

        long start = System.nanoTime();
        accumulator.add(log("lonely"));
        accumulator.add(log("also lonely"));
        Batch batch = batches.poll(2, TimeUnit.SECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(batch).isNotNull();
        assertThat(batch.size()).isEqualTo(2);
        assertThat(elapsedMillis).isBetween(150L, 1000L);
        assertThat(triggers).containsExactly(FlushTrigger.TIMEOUT);
    }

    @Test
    public void testSizeFlushCancelsTimedFlush() throws Exception {
        BatchAccumulator accumulator = accumulator(2, Duration.ofMillis(100));

        accumulator.add(log("a"));
        accumulator.add(log("b"));
        Thread.sleep(300);

        assertThat(batches).hasSize(1);
        assertThat(triggers).containsExactly(FlushTrigger.SIZE);
    }

    @Test
    public void testFlushOfEmptyBufferIsNoop() {
        BatchAccumulator accumulator = accumulator(2, Duration.ofSeconds(1));

        accumulator.flush();

        assertThat(batches).isEmpty();
    }

    @Test
    public void testBuffersAfterSchedulerShutdown() {
        BatchAccumulator accumulator = accumulator(10, Duration.ofMillis(10));
        scheduler.shutdown();

        accumulator.add(log("late"));
        accumulator.flush();

        assertThat(batches).hasSize(1);
    }
}
