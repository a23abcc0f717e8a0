package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.model.TelemetryResource;

import java.util.Objects;

/**
 * Copies the attributes of the collector's resource onto each record. Attributes the record already carries
 * are left untouched, which makes the stage idempotent.
 */
public class ResourceEnrichmentProcessor implements RecordProcessor {

    private final TelemetryResource resource;

    public ResourceEnrichmentProcessor(TelemetryResource resource) {
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    @Override
    public void process(TelemetryRecord record) {
        resource.attributes().forEach(record::appendAttribute);
    }
}
