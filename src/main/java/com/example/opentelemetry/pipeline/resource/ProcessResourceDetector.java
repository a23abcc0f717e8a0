package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;

import java.time.Instant;

class ProcessResourceDetector implements ResourceDetector {

    static final AttributeKey<String> PROCESS_START_TIME = AttributeKey.stringKey("process.start_time");

    @Override
    public String name() {
        return "process";
    }

    @Override
    public TelemetryResource detect() {
        ProcessHandle process = ProcessHandle.current();
        ProcessHandle.Info info = process.info();
        TelemetryResource.Builder builder = TelemetryResource.builder()
                .put(ResourceAttributes.PROCESS_PID, process.pid());
        info.command().ifPresent(command -> builder.put(ResourceAttributes.PROCESS_EXECUTABLE_PATH, command));
        info.startInstant().map(Instant::toString).ifPresent(startTime -> builder.put(PROCESS_START_TIME, startTime));
        putIfSet(builder, ResourceAttributes.PROCESS_RUNTIME_NAME, System.getProperty("java.runtime.name"));
        putIfSet(builder, ResourceAttributes.PROCESS_RUNTIME_VERSION, System.getProperty("java.runtime.version"));
        putIfSet(builder, ResourceAttributes.PROCESS_RUNTIME_DESCRIPTION, System.getProperty("java.vm.vendor") + " "
                + System.getProperty("java.vm.name") + " " + System.getProperty("java.vm.version"));
        return builder.build();
    }

    private static void putIfSet(TelemetryResource.Builder builder, AttributeKey<String> key, String value) {
        if (value != null && !value.isBlank()) {
            builder.put(key, value);
        }
    }
}
