package com.example.opentelemetry.pipeline.processor;

import com.example.opentelemetry.pipeline.model.TelemetryRecord;

/**
 * A transformation stage applied in order to every record, whatever its signal, before batching.
 */
@FunctionalInterface
public interface RecordProcessor {

    void process(TelemetryRecord record);
}
