package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.config.ConfigLoader;
import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.example.opentelemetry.pipeline.model.SignalType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.opentelemetry.pipeline.TestTelemetry.span;
import static org.assertj.core.api.Assertions.assertThat;

public class ExporterFactoryTest {

    @Test
    public void testCreatesOnlyExportersUsedByAPipeline() {
        PipelineConfig config = new ConfigLoader(Map.of()).parse("""
                receivers:
                  otlp:
                    grpc: {}
                exporters:
                  traces-grpc:
                    type: otlp
                    endpoint: localhost:14317
                  metrics-http:
                    type: otlphttp
                    endpoint: http://localhost:9090/api/v1/otlp
                  debug:
                    type: logging
                  unused:
                    type: logging
                service:
                  pipelines:
                    traces:
                      exporters: [traces-grpc, debug]
                    metrics:
                      exporters: [metrics-http]
                """);

        List<TelemetryExporter> exporters = ExporterFactory.createAll(config);
        try {
            assertThat(exporters).extracting(TelemetryExporter::name)
                    .containsExactly("traces-grpc", "metrics-http", "debug");
            assertThat(exporters).extracting(exporter -> exporter.getClass().getSimpleName())
                    .containsExactly("OtlpGrpcExporter", "OtlpHttpExporter", "LoggingExporter");
        } finally {
            exporters.forEach(TelemetryExporter::shutdown);
        }
    }

    @Test
    public void testLoggingExporterAlwaysSucceeds() {
        LoggingExporter exporter = new LoggingExporter("debug");

        assertThat(exporter.export(SignalType.SPAN, List.of(span("GET /"))).isSuccess()).isTrue();
        exporter.shutdown();
    }
}
