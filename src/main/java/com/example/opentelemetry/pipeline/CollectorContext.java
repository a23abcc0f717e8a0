package com.example.opentelemetry.pipeline;

import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.api.metrics.Meter;

import java.util.Objects;

/**
 * Process wide, read-only state handed to every component constructor: the configuration, the resource
 * resolved for this process and the meter used for the collector's own telemetry.
 */
public final class CollectorContext {

    public static final String INSTRUMENTATION_NAME = "otel-telemetry-pipeline";

    private final PipelineConfig config;
    private final TelemetryResource resource;
    private final Meter meter;

    public CollectorContext(PipelineConfig config, TelemetryResource resource, Meter meter) {
        this.config = Objects.requireNonNull(config, "config");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.meter = Objects.requireNonNull(meter, "meter");
    }

    public PipelineConfig config() {
        return config;
    }

    public TelemetryResource resource() {
        return resource;
    }

    public Meter meter() {
        return meter;
    }
}
