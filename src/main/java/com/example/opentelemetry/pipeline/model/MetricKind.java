package com.example.opentelemetry.pipeline.model;

public enum MetricKind {
    GAUGE,
    SUM,
    HISTOGRAM,
    EXPONENTIAL_HISTOGRAM,
    SUMMARY
}
