package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.CollectorContext;
import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.example.opentelemetry.pipeline.model.Batch;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.util.Threads;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Groups records into batches per destination.
 * <p>
 * Signals routed to the same set of exporters share one {@link BatchAccumulator}, so a batch may mix metrics,
 * logs and spans. Records of a signal that has no pipeline, and records handed over after {@link #shutdown},
 * are dropped and counted.
 */
public class BatchProcessor {

    static final AttributeKey<String> TRIGGER = AttributeKey.stringKey("trigger");
    static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final Map<SignalType, BatchAccumulator> accumulatorsBySignal = new EnumMap<>(SignalType.class);
    private final Map<Set<String>, BatchAccumulator> accumulators = new LinkedHashMap<>();
    private final ScheduledThreadPoolExecutor scheduler;
    private final LongCounter batchesCounter;
    private final LongHistogram batchSizeHistogram;
    private final LongCounter droppedRecordsCounter;
    private final Object stateLock = new Object();
    private boolean stopped;

    public BatchProcessor(CollectorContext context, Consumer<Batch> downstream) {
        PipelineConfig config = context.config();
        PipelineConfig.BatchConfig batchConfig = config.processors().batch();

        this.batchesCounter = context.meter().counterBuilder("processor.batch.batches")
                .setDescription("Number of batches cut, by trigger").build();
        this.batchSizeHistogram = context.meter().histogramBuilder("processor.batch.batch_send_size")
                .setDescription("Number of records per batch").ofLongs().build();
        this.droppedRecordsCounter = context.meter().counterBuilder("processor.batch.dropped_records")
                .setDescription("Number of records dropped before batching, by reason").build();

        this.scheduler = Threads.newScheduler("batch-flush-scheduler", logger);

        AtomicLong sequence = new AtomicLong();
        for (SignalType signal : SignalType.values()) {
            Set<String> destinations = config.exportersFor(signal);
            if (destinations.isEmpty()) {
                continue;
            }
            BatchAccumulator accumulator = accumulators.computeIfAbsent(Set.copyOf(destinations),
                    key -> new BatchAccumulator(key, batchConfig.sendBatchSize(), batchConfig.timeout(), scheduler,
                            sequence, downstream, this::recordFlush));
            accumulatorsBySignal.put(signal, accumulator);
        }
        logger.info("Batching {} record(s) or {} per batch for destinations {}",
                batchConfig.sendBatchSize(), batchConfig.timeout(), accumulators.keySet());
    }

    public void process(TelemetryRecord record) {
        BatchAccumulator accumulator = accumulatorsBySignal.get(record.signalType());
        if (accumulator == null) {
            logger.debug("Drop {} record, no {} pipeline configured", record.signalType(), record.signalType().pipelineName());
            droppedRecordsCounter.add(1, Attributes.of(REASON, "no_pipeline"));
            return;
        }
        synchronized (stateLock) {
            if (stopped) {
                logger.warn("Drop {} record received after the batch processor was shut down", record.signalType());
                droppedRecordsCounter.add(1, Attributes.of(REASON, "shutdown"));
                return;
            }
            accumulator.add(record);
        }
    }

    public void flushAll() {
        accumulators.values().forEach(BatchAccumulator::flush);
    }

    Collection<BatchAccumulator> accumulators() {
        return accumulators.values();
    }

    /**
     * Stops the timed flushes then flushes what is left. Records processed afterwards are dropped.
     */
    public void shutdown(Duration timeout) throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            logger.warn("Batch flush scheduler did not terminate within {}", timeout);
        }
        synchronized (stateLock) {
            stopped = true;
            flushAll();
        }
    }

    private void recordFlush(Batch batch, BatchAccumulator.FlushTrigger trigger) {
        Attributes attributes = Attributes.of(TRIGGER, trigger.name().toLowerCase(Locale.ROOT));
        batchesCounter.add(1, attributes);
        batchSizeHistogram.record(batch.size(), attributes);
    }
}
