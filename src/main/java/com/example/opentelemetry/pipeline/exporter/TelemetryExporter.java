package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.model.ExportResult;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;

import java.util.List;

/**
 * A named sink. Implementations are called from a single thread, the delivery thread of the exporter, and
 * must report failures through the returned {@link ExportResult} rather than by throwing.
 */
public interface TelemetryExporter {

    String name();

    ExportResult export(SignalType signal, List<TelemetryRecord> records);

    void shutdown();
}
