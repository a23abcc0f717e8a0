package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.model.Batch;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.google.common.base.MoreObjects;
import com.google.common.base.Verify;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Buffers the records bound for one set of exporters and cuts them into batches.
 * <p>
 * A batch is cut as soon as {@code sendBatchSize} records are buffered, or when the oldest buffered record has
 * waited {@code timeout} since it was received, whichever happens first. Batches are handed downstream in the
 * order they are cut, while holding the accumulator lock, so the downstream consumer must not block.
 */
public class BatchAccumulator {

    public enum FlushTrigger {
        SIZE,
        TIMEOUT,
        SHUTDOWN
    }

    @FunctionalInterface
    public interface FlushListener {
        void onFlush(Batch batch, FlushTrigger trigger);
    }

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final Set<String> destinations;
    private final int sendBatchSize;
    private final long timeoutNanos;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong sequence;
    private final Consumer<Batch> downstream;
    private final FlushListener listener;

    private final Object lock = new Object();
    private List<TelemetryRecord> buffer = new ArrayList<>();
    private long generation;
    @Nullable
    private ScheduledFuture<?> pendingFlush;

    public BatchAccumulator(Set<String> destinations,
                            int sendBatchSize,
                            Duration timeout,
                            ScheduledExecutorService scheduler,
                            AtomicLong sequence,
                            Consumer<Batch> downstream,
                            FlushListener listener) {
        Verify.verify(sendBatchSize > 0, "sendBatchSize must be greater than 0");
        Verify.verify(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        this.destinations = Set.copyOf(destinations);
        this.sendBatchSize = sendBatchSize;
        this.timeoutNanos = timeout.toNanos();
        this.scheduler = Objects.requireNonNull(scheduler);
        this.sequence = Objects.requireNonNull(sequence);
        this.downstream = Objects.requireNonNull(downstream);
        this.listener = Objects.requireNonNull(listener);
    }

    public Set<String> destinations() {
        return destinations;
    }

    public void add(TelemetryRecord record) {
        synchronized (lock) {
            if (buffer.isEmpty()) {
                scheduleTimedFlush(record.receivedNanoTime());
            }
            buffer.add(record);
            if (buffer.size() >= sendBatchSize) {
                cut(FlushTrigger.SIZE);
            }
        }
    }

    /**
     * Cuts whatever is buffered, regardless of size and age.
     */
    public void flush() {
        synchronized (lock) {
            if (!buffer.isEmpty()) {
                cut(FlushTrigger.SHUTDOWN);
            }
        }
    }

    public int bufferedCount() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    private void scheduleTimedFlush(long oldestReceivedNanoTime) {
        long ageNanos = System.nanoTime() - oldestReceivedNanoTime;
        long delayNanos = Math.max(0, timeoutNanos - ageNanos);
        long scheduledGeneration = generation;
        try {
            pendingFlush = scheduler.schedule(() -> flushIfUnchanged(scheduledGeneration), delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            // stopped during shutdown, the final flush takes these records
            logger.debug("Timed flush not scheduled for {}, the scheduler is shut down", destinations);
            pendingFlush = null;
        }
    }

    private void flushIfUnchanged(long scheduledGeneration) {
        synchronized (lock) {
            if (generation == scheduledGeneration && !buffer.isEmpty()) {
                cut(FlushTrigger.TIMEOUT);
            }
        }
    }

    private void cut(FlushTrigger trigger) {
        List<TelemetryRecord> records = buffer;
        buffer = new ArrayList<>();
        generation++;
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
        Batch batch = new Batch(sequence.incrementAndGet(), currentTimeUnixNano(), records, destinations);
        logger.debug("Flushing {} on {}", batch, trigger);
        listener.onFlush(batch, trigger);
        downstream.accept(batch);
    }

    private static long currentTimeUnixNano() {
        return TimeUnit.MILLISECONDS.toNanos(System.currentTimeMillis());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("destinations", destinations)
                .add("sendBatchSize", sendBatchSize)
                .add("timeoutNanos", timeoutNanos)
                .toString();
    }
}
