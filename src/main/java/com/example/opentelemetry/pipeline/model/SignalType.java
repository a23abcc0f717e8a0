package com.example.opentelemetry.pipeline.model;

public enum SignalType {
    METRIC("metrics"),
    LOG("logs"),
    SPAN("traces");

    private final String pipelineName;

    SignalType(String pipelineName) {
        this.pipelineName = pipelineName;
    }

    public String pipelineName() {
        return pipelineName;
    }
}
