package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import oshi.hardware.CentralProcessor;

import java.util.List;
import java.util.Map;

class LoadScraper implements HostMetricsScraper {

    static final List<MetricDescriptor> LOAD_AVERAGES = List.of(
            MetricDescriptor.gauge("system.cpu.load_average.1m", "{thread}", "Average CPU Load over 1 minute."),
            MetricDescriptor.gauge("system.cpu.load_average.5m", "{thread}", "Average CPU Load over 5 minutes."),
            MetricDescriptor.gauge("system.cpu.load_average.15m", "{thread}", "Average CPU Load over 15 minutes."));

    private final CentralProcessor processor;

    LoadScraper(CentralProcessor processor) {
        this.processor = processor;
    }

    @Override
    public String name() {
        return "load";
    }

    @Override
    public void scrape(MetricPoints points) {
        double[] averages = processor.getSystemLoadAverage(LOAD_AVERAGES.size());
        for (int i = 0; i < averages.length && i < LOAD_AVERAGES.size(); i++) {
            if (averages[i] >= 0) {
                points.gauge(LOAD_AVERAGES.get(i), averages[i], Map.of());
            }
        }
    }
}
