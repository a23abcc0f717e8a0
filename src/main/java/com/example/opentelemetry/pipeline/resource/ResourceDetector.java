package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.TelemetryResource;

public interface ResourceDetector {

    String name();

    /**
     * @return the detected attributes, {@link TelemetryResource#EMPTY} when the detector does not apply here
     */
    TelemetryResource detect() throws Exception;
}
