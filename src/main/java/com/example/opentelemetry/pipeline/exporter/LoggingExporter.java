package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.model.ExportResult;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.otlp.OtlpEncoder;
import com.example.opentelemetry.pipeline.otlp.OtlpJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class LoggingExporter implements TelemetryExporter {

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;

    public LoggingExporter(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExportResult export(SignalType signal, List<TelemetryRecord> records) {
        logger.info("{}: {} {} record(s)", name, records.size(), signal.pipelineName());
        if (logger.isDebugEnabled()) {
            logger.debug("{}: {}", name, OtlpJson.print(switch (signal) {
                case METRIC -> OtlpEncoder.encodeMetrics(records);
                case LOG -> OtlpEncoder.encodeLogs(records);
                case SPAN -> OtlpEncoder.encodeSpans(records);
            }));
        }
        return ExportResult.success();
    }

    @Override
    public void shutdown() {
        // nothing to release
    }
}
