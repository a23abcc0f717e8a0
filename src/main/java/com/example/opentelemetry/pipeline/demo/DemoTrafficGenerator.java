package com.example.opentelemetry.pipeline.demo;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sample application that sends a trace and two metrics to the collector every couple of seconds, configured
 * through the standard OTLP client variables.
 */
public class DemoTrafficGenerator {
    static final String INSTRUMENTATION_NAME = "com.example.opentelemetry.pipeline.demo";
    static final AttributeKey<Long> REQUEST_ID = AttributeKey.longKey("request.id");
    static final AttributeKey<Double> REQUEST_LATENCY_MS = AttributeKey.doubleKey("request.latency_ms");
    static final Attributes SUCCESS = Attributes.of(AttributeKey.stringKey("status"), "success");
    static final Attributes DEMO_ENDPOINT = Attributes.of(AttributeKey.stringKey("endpoint"), "/demo");

    private static final Logger logger = LoggerFactory.getLogger(DemoTrafficGenerator.class);
    private static final Duration PAUSE = Duration.ofSeconds(2);
    private static final long METRIC_EXPORT_INTERVAL_MILLIS = 5000;

    private final Tracer tracer;
    private final LongCounter requestCounter;
    private final DoubleHistogram latencyHistogram;

    public static void main(String[] args) throws InterruptedException {
        Map<String, String> env = new HashMap<>(System.getenv());
        env.putIfAbsent(ClientTelemetryOptions.RESOURCE_ATTRIBUTES_ENV, "service.namespace=homelab,deployment.environment=local");
        ClientTelemetryOptions options = ClientTelemetryOptions.fromEnvironment(env, "java-demo");

        OpenTelemetrySdk sdk = AutoConfiguredOpenTelemetrySdk
                .builder()
                .addPropertiesSupplier(() -> options.toAutoConfigureProperties(METRIC_EXPORT_INTERVAL_MILLIS))
                .build()
                .getOpenTelemetrySdk();
        Runtime.getRuntime().addShutdownHook(new Thread(sdk::close, "demo-shutdown"));

        logger.info("Starting demo (sending to {} over {})...", options.endpoint(), options.protocol().value());
        DemoTrafficGenerator generator = new DemoTrafficGenerator(sdk);
        long count = 0;
        while (!Thread.currentThread().isInterrupted()) {
            count++;
            double latency = generator.sendOnce(count);
            logger.info("[{}] Sent trace and metrics (latency: {}ms)", count, String.format("%.1f", latency));
            Thread.sleep(PAUSE.toMillis());
        }
    }

    public DemoTrafficGenerator(OpenTelemetry openTelemetry) {
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        Meter meter = openTelemetry.getMeter(INSTRUMENTATION_NAME);
        this.requestCounter = meter.counterBuilder("demo.requests")
                .setDescription("Number of demo requests").build();
        this.latencyHistogram = meter.histogramBuilder("demo.latency")
                .setDescription("Request latency in ms").setUnit("ms").build();
    }

    public double sendOnce(long requestId) throws InterruptedException {
        double latency = ThreadLocalRandom.current().nextDouble(10, 200);
        Span span = tracer.spanBuilder("demo-operation").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute(REQUEST_ID, requestId);
            span.setAttribute(REQUEST_LATENCY_MS, latency);

            Span child = tracer.spanBuilder("process-data").startSpan();
            try (Scope ignoredChild = child.makeCurrent()) {
                Thread.sleep((long) latency);
            } finally {
                child.end();
            }

            requestCounter.add(1, SUCCESS);
            latencyHistogram.record(latency, DEMO_ENDPOINT);
        } finally {
            span.end();
        }
        return latency;
    }
}
