package com.example.opentelemetry.pipeline.hostmetrics;

/**
 * Reads one family of operating system counters. Called from the sampler thread only, so implementations may
 * keep state between scrapes.
 */
public interface HostMetricsScraper {

    String name();

    void scrape(MetricPoints points);
}
