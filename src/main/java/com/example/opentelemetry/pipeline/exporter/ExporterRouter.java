package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.CollectorContext;
import com.example.opentelemetry.pipeline.config.ExporterConfig;
import com.example.opentelemetry.pipeline.model.Batch;
import com.example.opentelemetry.pipeline.model.ExportResult;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.util.Threads;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Delivers each batch to every exporter it is routed to.
 * <p>
 * Every exporter owns a delivery thread fed by a bounded queue of batches, so a slow or failing backend never
 * delays the others. When the queue of an exporter is full the batch is dropped for that exporter only.
 * Inside a batch, records are sent one signal at a time and each signal is retried on its own, so records
 * already accepted by the backend are never sent twice.
 */
public class ExporterRouter {

    static final AttributeKey<String> EXPORTER = AttributeKey.stringKey("exporter");
    static final AttributeKey<String> SIGNAL = AttributeKey.stringKey("signal");

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final Map<String, Route> routes = new LinkedHashMap<>();
    private final LongCounter sentRecordsCounter;
    private final LongCounter failedRecordsCounter;
    private final LongCounter droppedBatchesCounter;
    private final LongCounter retriesCounter;

    public ExporterRouter(CollectorContext context, Collection<TelemetryExporter> exporters) {
        this.sentRecordsCounter = context.meter().counterBuilder("exporter.sent_records")
                .setDescription("Number of records accepted by the backend").build();
        this.failedRecordsCounter = context.meter().counterBuilder("exporter.send_failed_records")
                .setDescription("Number of records given up on after a permanent failure or exhausted retries").build();
        this.droppedBatchesCounter = context.meter().counterBuilder("exporter.enqueue_failed_batches")
                .setDescription("Number of batches dropped because the exporter queue was full").build();
        this.retriesCounter = context.meter().counterBuilder("exporter.retries")
                .setDescription("Number of delivery attempts retried after a retryable failure").build();

        for (TelemetryExporter exporter : exporters) {
            ExporterConfig config = context.config().exporters().get(exporter.name());
            Objects.requireNonNull(config, () -> "No configuration for exporter " + exporter.name());
            routes.put(exporter.name(), new Route(exporter, new RetryPolicy(config.retry()), config.queueSize()));
        }
    }

    /**
     * Queues the batch on each of its destinations.
     *
     * @return a future completed with the final outcome per destination, once every destination gave up or
     * delivered the whole batch
     */
    public CompletableFuture<Map<String, ExportResult>> dispatch(Batch batch) {
        Map<String, CompletableFuture<ExportResult>> outcomes = new LinkedHashMap<>();
        for (String destination : batch.destinations()) {
            Route route = routes.get(destination);
            if (route == null) {
                logger.error("Drop {} for unknown exporter '{}'", batch, destination);
                outcomes.put(destination, CompletableFuture.completedFuture(ExportResult.permanent("unknown exporter " + destination)));
                continue;
            }
            outcomes.put(destination, route.submit(batch));
        }
        return CompletableFuture.allOf(outcomes.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    Map<String, ExportResult> results = new LinkedHashMap<>();
                    outcomes.forEach((name, future) -> results.put(name, future.join()));
                    return results;
                });
    }

    /**
     * Lets the exporters work through their queues for at most {@code timeout}, then interrupts the deliveries
     * still in progress and shuts the exporters down.
     *
     * @return {@code true} if every queued batch was handled in time
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        routes.values().forEach(route -> route.executor.shutdown());
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean completed = true;
        for (Route route : routes.values()) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!route.executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                List<Runnable> abandoned = route.executor.shutdownNow();
                logger.warn("Exporter '{}' did not finish within {}, {} batch(es) abandoned",
                        route.exporter.name(), timeout, abandoned.size());
                completed = false;
            }
        }
        for (Route route : routes.values()) {
            try {
                route.exporter.shutdown();
            } catch (RuntimeException e) {
                logger.warn("Failed to shut down exporter '{}'", route.exporter.name(), e);
            }
        }
        return completed;
    }

    private ExportResult deliver(Route route, Batch batch) {
        ExportResult outcome = ExportResult.success();
        for (Map.Entry<SignalType, List<TelemetryRecord>> group : batch.recordsBySignal().entrySet()) {
            ExportResult result = deliver(route, group.getKey(), group.getValue());
            Attributes attributes = Attributes.of(EXPORTER, route.exporter.name(), SIGNAL, group.getKey().pipelineName());
            if (result.isSuccess()) {
                sentRecordsCounter.add(group.getValue().size(), attributes);
            } else {
                failedRecordsCounter.add(group.getValue().size(), attributes);
                logger.error("Exporter '{}' dropped {} {} record(s) of batch {}: {}", route.exporter.name(),
                        group.getValue().size(), group.getKey().pipelineName(), batch.sequence(), result.message());
                if (outcome.isSuccess()) {
                    outcome = result;
                }
            }
        }
        return outcome;
    }

    private ExportResult deliver(Route route, SignalType signal, List<TelemetryRecord> records) {
        TelemetryExporter exporter = route.exporter;
        int attempts = 0;
        while (true) {
            ExportResult result;
            try {
                result = exporter.export(signal, records);
            } catch (RuntimeException e) {
                logger.warn("Exporter '{}' failed unexpectedly", exporter.name(), e);
                result = ExportResult.permanent(e.toString());
            }
            attempts++;
            if (result.isSuccess() || !result.isRetryable()) {
                return result;
            }
            if (!route.retryPolicy.canRetry(attempts)) {
                return ExportResult.permanent("gave up after " + attempts + " attempt(s): " + result.message());
            }
            Duration backoff = route.retryPolicy.backoff(attempts, result.retryAfter());
            logger.info("Exporter '{}' failed to send {} {} record(s) ({}), retrying in {}",
                    exporter.name(), records.size(), signal.pipelineName(), result.message(), backoff);
            retriesCounter.add(1, Attributes.of(EXPORTER, exporter.name(), SIGNAL, signal.pipelineName()));
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ExportResult.permanent("interrupted while waiting to retry: " + result.message());
            }
        }
    }

    private final class Route {
        private final TelemetryExporter exporter;
        private final RetryPolicy retryPolicy;
        private final ThreadPoolExecutor executor;

        private Route(TelemetryExporter exporter, RetryPolicy retryPolicy, int queueSize) {
            this.exporter = exporter;
            this.retryPolicy = retryPolicy;
            this.executor = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(queueSize),
                    Threads.daemonThreadFactory("exporter-" + exporter.name(), false, logger));
        }

        private CompletableFuture<ExportResult> submit(Batch batch) {
            try {
                return CompletableFuture.supplyAsync(() -> deliver(this, batch), executor);
            } catch (RejectedExecutionException e) {
                logger.warn("Drop {} for exporter '{}', its queue is full or it is shut down", batch, exporter.name());
                droppedBatchesCounter.add(1, Attributes.of(EXPORTER, exporter.name()));
                return CompletableFuture.completedFuture(ExportResult.permanent("exporter queue full"));
            }
        }
    }
}
