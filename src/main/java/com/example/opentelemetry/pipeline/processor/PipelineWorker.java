package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer of the {@link IngressQueue}: applies the record processors in order then hands each record
 * to the {@link BatchProcessor}. Records are the property of this thread until they are batched.
 */
public class PipelineWorker implements Runnable {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final IngressQueue queue;
    private final List<RecordProcessor> processors;
    private final BatchProcessor batchProcessor;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Thread thread;
    private volatile boolean draining;

    public PipelineWorker(IngressQueue queue, List<RecordProcessor> processors, BatchProcessor batchProcessor) {
        this.queue = Objects.requireNonNull(queue);
        this.processors = List.copyOf(processors);
        this.batchProcessor = Objects.requireNonNull(batchProcessor);
        this.thread = Threads.daemonThreadFactory("pipeline-worker", false, logger).newThread(this);
    }

    public void start() {
        thread.start();
    }

    @Override
    public void run() {
        logger.debug("Pipeline worker started");
        try {
            while (!(draining && queue.isEmpty())) {
                List<TelemetryRecord> records = queue.poll(POLL_INTERVAL);
                if (records != null) {
                    handle(records);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Pipeline worker interrupted with {} request(s) still queued", queue.size());
        } finally {
            terminated.countDown();
            logger.debug("Pipeline worker stopped");
        }
    }

    Thread thread() {
        return thread;
    }

    void handle(List<TelemetryRecord> records) {
        for (TelemetryRecord record : records) {
            try {
                for (RecordProcessor processor : processors) {
                    processor.process(record);
                }
            } catch (RuntimeException e) {
                logger.warn("Drop {} record, processing failed", record.signalType(), e);
                continue;
            }
            batchProcessor.process(record);
        }
    }

    /**
     * Closes the ingress queue, then waits for the requests already queued to be processed.
     *
     * @return {@code true} if the queue was fully drained within the timeout
     */
    public boolean drain(Duration timeout) throws InterruptedException {
        queue.close();
        draining = true;
        boolean drained = terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!drained) {
            logger.warn("Ingress queue not drained within {}, {} request(s) abandoned", timeout, queue.size());
            thread.interrupt();
        }
        return drained;
    }
}
