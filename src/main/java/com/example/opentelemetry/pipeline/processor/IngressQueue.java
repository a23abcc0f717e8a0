package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between producers (receivers, host metrics sampler) and the pipeline worker.
 * <p>
 * Each entry holds all the records of one ingest request, so a request is either fully enqueued or refused, and
 * the records of a request keep their order. Producers wait at most the given timeout for room.
 */
public class IngressQueue {

    private final BlockingQueue<List<TelemetryRecord>> queue;
    private final int capacity;
    private volatile boolean closed;

    public IngressQueue(int capacity) {
        Preconditions.checkArgument(capacity > 0, "capacity must be greater than 0");
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues the records of one request.
     *
     * @throws BackpressureException if no room became available within {@code timeout}, if the calling thread
     *                               was interrupted while waiting or if the queue is closed
     */
    public void offer(List<TelemetryRecord> records, Duration timeout) throws BackpressureException {
        if (closed) {
            throw new BackpressureException("collector is shutting down");
        }
        if (records.isEmpty()) {
            return;
        }
        boolean accepted;
        try {
            accepted = queue.offer(List.copyOf(records), timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackpressureException("interrupted while waiting for room in the ingress queue");
        }
        if (!accepted) {
            throw new BackpressureException("ingress queue is full (" + capacity + " pending requests), retry later");
        }
    }

    /**
     * Waits up to {@code timeout} for the next request.
     *
     * @return the records of the request, or {@code null} if none arrived in time
     */
    @Nullable
    public List<TelemetryRecord> poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Refuses every subsequent {@link #offer}. Requests already enqueued stay available to {@link #poll}.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
