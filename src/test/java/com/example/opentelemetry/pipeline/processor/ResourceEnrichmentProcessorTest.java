package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.model.AnyValues;
import com.example.opentelemetry.pipeline.model.SpanRecord;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.opentelemetry.pipeline.TestTelemetry.span;
import static org.assertj.core.api.Assertions.assertThat;

public class ResourceEnrichmentProcessorTest {

    private final TelemetryResource resource = TelemetryResource.builder()
            .put("host.name", "collector-1")
            .put("deployment.environment", "homelab")
            .build();

    @Test
    public void testAddsMissingAttributes() {
        SpanRecord record = span("GET /");

        new ResourceEnrichmentProcessor(resource).process(record);

        assertThat(record.attributes())
                .containsEntry("host.name", AnyValues.of("collector-1"))
                .containsEntry("deployment.environment", AnyValues.of("homelab"));
    }

    @Test
    public void testNeverOverwritesExistingAttributes() {
        SpanRecord record = span("GET /", Map.of("host.name", AnyValues.of("client-7")));

        new ResourceEnrichmentProcessor(resource).process(record);

        assertThat(record.attributes()).containsEntry("host.name", AnyValues.of("client-7"));
    }

    @Test
    public void testIsIdempotent() {
        ResourceEnrichmentProcessor processor = new ResourceEnrichmentProcessor(resource);
        SpanRecord record = span("GET /");

        processor.process(record);
        Map<String, ?> once = Map.copyOf(record.attributes());
        processor.process(record);

        assertThat(record.attributes()).isEqualTo(once).hasSize(2);
    }
}
