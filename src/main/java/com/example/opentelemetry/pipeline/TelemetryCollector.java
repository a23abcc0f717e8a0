package com.example.opentelemetry.pipeline;

import com.example.opentelemetry.pipeline.config.ConfigLoader;
import com.example.opentelemetry.pipeline.config.ConfigurationException;
import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.example.opentelemetry.pipeline.exporter.ExporterFactory;
import com.example.opentelemetry.pipeline.exporter.ExporterRouter;
import com.example.opentelemetry.pipeline.exporter.TelemetryExporter;
import com.example.opentelemetry.pipeline.health.HealthCheckServer;
import com.example.opentelemetry.pipeline.hostmetrics.HostMetricsSampler;
import com.example.opentelemetry.pipeline.hostmetrics.HostMetricsScrapers;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import com.example.opentelemetry.pipeline.processor.BatchProcessor;
import com.example.opentelemetry.pipeline.processor.IngressQueue;
import com.example.opentelemetry.pipeline.processor.PipelineWorker;
import com.example.opentelemetry.pipeline.processor.ResourceEnrichmentProcessor;
import com.example.opentelemetry.pipeline.receiver.OtlpGrpcReceiver;
import com.example.opentelemetry.pipeline.receiver.OtlpHttpReceiver;
import com.example.opentelemetry.pipeline.receiver.TelemetryIngest;
import com.example.opentelemetry.pipeline.resource.ResourceResolver;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.SystemInfo;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Wires receivers, the processing pipeline and the exporters together, and runs them until the JVM shuts down.
 */
public class TelemetryCollector {
    static final String CONFIG_ENV = "COLLECTOR_CONFIG";

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final CollectorContext context;
    private final IngressQueue ingressQueue;
    private final TelemetryIngest ingest;
    private final ExporterRouter router;
    private final BatchProcessor batchProcessor;
    private final PipelineWorker worker;
    @Nullable
    private final OtlpGrpcReceiver grpcReceiver;
    @Nullable
    private final OtlpHttpReceiver httpReceiver;
    @Nullable
    private final HealthCheckServer healthCheckServer;
    @Nullable
    private HostMetricsSampler sampler;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private boolean shutdown;

    public static void main(String[] args) throws Exception {

        AutoConfiguredOpenTelemetrySdk sdk = AutoConfiguredOpenTelemetrySdk
                .builder()
                .addPropertiesSupplier(() -> Map.of(
                        "otel.metrics.exporter", "none",
                        "otel.traces.exporter", "none",
                        "otel.logs.exporter", "none"))
                .addResourceCustomizer((resource, configProperties) -> resource.merge(Resource.builder().put(ResourceAttributes.SERVICE_NAME, CollectorContext.INSTRUMENTATION_NAME).build()))
                .setResultAsGlobal()
                .build();

        TelemetryCollector collector;
        try {
            PipelineConfig config = new ConfigLoader().load(configPath(args, System.getenv()));
            TelemetryResource resource = ResourceResolver.fromConfig(config.processors().resourceDetection(), System.getenv()).resolve();
            CollectorContext context = new CollectorContext(config, resource, GlobalOpenTelemetry.getMeter(CollectorContext.INSTRUMENTATION_NAME));
            collector = new TelemetryCollector(context, ExporterFactory.createAll(config));
        } catch (ConfigurationException e) {
            LoggerFactory.getLogger(TelemetryCollector.class).error(e.getMessage());
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            collector.shutdown();
            sdk.getOpenTelemetrySdk().close();
        }, "collector-shutdown"));

        try {
            collector.start();
        } catch (Exception e) {
            System.exit(1);
            return;
        }
        collector.awaitTermination();
    }

    public TelemetryCollector(CollectorContext context, List<TelemetryExporter> exporters) {
        this.context = context;
        PipelineConfig config = context.config();

        this.ingressQueue = new IngressQueue(config.processors().queue().capacity());
        this.ingest = new TelemetryIngest(context, ingressQueue);
        this.router = new ExporterRouter(context, exporters);
        this.batchProcessor = new BatchProcessor(context, router::dispatch);
        this.worker = new PipelineWorker(ingressQueue,
                List.of(new ResourceEnrichmentProcessor(context.resource())), batchProcessor);

        PipelineConfig.OtlpReceiverConfig otlp = config.receivers().otlp();
        this.grpcReceiver = otlp == null || otlp.grpc() == null ? null : new OtlpGrpcReceiver(otlp.grpc(), ingest);
        this.httpReceiver = otlp == null || otlp.http() == null ? null : new OtlpHttpReceiver(otlp.http(), ingest);
        this.healthCheckServer = config.extensions().healthCheck().enabled()
                ? new HealthCheckServer(config.extensions().healthCheck())
                : null;
    }

    /**
     * Starts every component. If one fails, what was already started is shut down before the failure is rethrown.
     */
    public synchronized void start() throws Exception {
        try {
            if (healthCheckServer != null) {
                healthCheckServer.start();
            }
            worker.start();
            if (grpcReceiver != null) {
                grpcReceiver.start();
            }
            if (httpReceiver != null) {
                httpReceiver.start();
            }
            PipelineConfig.HostMetricsConfig hostMetrics = context.config().receivers().hostmetrics();
            if (hostMetrics != null) {
                if (ingest.accepts(SignalType.METRIC)) {
                    SystemInfo systemInfo = new SystemInfo();
                    long bootTimeUnixNano = TimeUnit.SECONDS.toNanos(systemInfo.getOperatingSystem().getSystemBootTime());
                    sampler = new HostMetricsSampler(context, ingest, HostMetricsScrapers.create(hostMetrics.scrapers(), systemInfo),
                            hostMetrics.collectionInterval(), bootTimeUnixNano);
                    sampler.start();
                } else {
                    logger.warn("Host metrics receiver configured without a metrics pipeline, not starting it");
                }
            }
            if (healthCheckServer != null) {
                healthCheckServer.ready();
            }
        } catch (Exception e) {
            logger.error("Failed to start the collector, shutting down", e);
            shutdown();
            throw e;
        }
    }

    @Nullable
    public OtlpGrpcReceiver grpcReceiver() {
        return grpcReceiver;
    }

    @Nullable
    public OtlpHttpReceiver httpReceiver() {
        return httpReceiver;
    }

    @Nullable
    public HealthCheckServer healthCheckServer() {
        return healthCheckServer;
    }

    /**
     * Stops the collector: receivers first, then the queued requests are processed, partial batches are
     * flushed and the exporters get {@code shutdownTimeout} to deliver them. A step that times out is logged and
     * the next one runs anyway.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        PipelineConfig.ServiceConfig service = context.config().service();
        Duration drainTimeout = service.drainTimeout();
        logger.info("Shutting down");

        if (healthCheckServer != null) {
            healthCheckServer.notReady();
        }
        if (sampler != null) {
            sampler.stop();
        }
        try {
            if (grpcReceiver != null) {
                grpcReceiver.stop(drainTimeout);
            }
        } catch (Exception e) {
            logger.warn("Failed to stop the OTLP gRPC receiver", e);
        }
        try {
            if (httpReceiver != null) {
                httpReceiver.stop(drainTimeout);
            }
        } catch (Exception e) {
            logger.warn("Failed to stop the OTLP HTTP receiver", e);
        }
        try {
            worker.drain(drainTimeout);
            batchProcessor.shutdown(drainTimeout);
            if (!router.shutdown(service.shutdownTimeout())) {
                logger.warn("Some batches were not exported before shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while shutting down, pending telemetry is lost");
        }
        try {
            if (healthCheckServer != null) {
                healthCheckServer.stop();
            }
        } catch (Exception e) {
            logger.warn("Failed to stop the health check server", e);
        }
        logger.info("*** collector shut down");
        terminated.countDown();
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    static Path configPath(String[] args, Map<String, String> env) {
        if (args.length > 0) {
            return Paths.get(args[0]);
        }
        String path = env.get(CONFIG_ENV);
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("No configuration file, pass its path as first argument or set " + CONFIG_ENV);
        }
        return Paths.get(path);
    }
}
