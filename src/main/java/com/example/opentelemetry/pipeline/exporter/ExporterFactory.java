package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.config.ExporterConfig;
import com.example.opentelemetry.pipeline.config.PipelineConfig;

import java.util.ArrayList;
import java.util.List;

public final class ExporterFactory {

    private ExporterFactory() {
    }

    public static TelemetryExporter create(String name, ExporterConfig config) {
        return switch (config.type()) {
            case OTLP -> new OtlpGrpcExporter(name, config);
            case OTLP_HTTP -> new OtlpHttpExporter(name, config);
            case LOGGING -> new LoggingExporter(name);
        };
    }

    public static List<TelemetryExporter> createAll(PipelineConfig config) {
        List<TelemetryExporter> exporters = new ArrayList<>();
        config.exporters().forEach((name, exporterConfig) -> {
            boolean used = config.service().pipelines().values().stream()
                    .anyMatch(route -> route.exporters().contains(name));
            if (used) {
                exporters.add(create(name, exporterConfig));
            }
        });
        return exporters;
    }
}
