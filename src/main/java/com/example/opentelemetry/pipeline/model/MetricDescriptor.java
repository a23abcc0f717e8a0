package com.example.opentelemetry.pipeline.model;

import io.opentelemetry.proto.metrics.v1.AggregationTemporality;

import java.util.Objects;

public record MetricDescriptor(String name,
                               String description,
                               String unit,
                               MetricKind kind,
                               AggregationTemporality temporality,
                               boolean monotonic) {

    public MetricDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        description = description == null ? "" : description;
        unit = unit == null ? "" : unit;
        temporality = temporality == null ? AggregationTemporality.AGGREGATION_TEMPORALITY_UNSPECIFIED : temporality;
    }

    public static MetricDescriptor gauge(String name, String unit, String description) {
        return new MetricDescriptor(name, description, unit, MetricKind.GAUGE, null, false);
    }

    public static MetricDescriptor cumulativeSum(String name, String unit, String description, boolean monotonic) {
        return new MetricDescriptor(name, description, unit, MetricKind.SUM,
                AggregationTemporality.AGGREGATION_TEMPORALITY_CUMULATIVE, monotonic);
    }
}
