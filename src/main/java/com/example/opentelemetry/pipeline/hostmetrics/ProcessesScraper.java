package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import oshi.software.os.OperatingSystem;

import java.util.Map;

class ProcessesScraper implements HostMetricsScraper {

    static final MetricDescriptor PROCESSES_COUNT =
            MetricDescriptor.cumulativeSum("system.processes.count", "{processes}", "Total number of processes.", false);
    static final MetricDescriptor THREADS_COUNT =
            MetricDescriptor.cumulativeSum("system.threads.count", "{threads}", "Total number of threads.", false);

    private final OperatingSystem operatingSystem;

    ProcessesScraper(OperatingSystem operatingSystem) {
        this.operatingSystem = operatingSystem;
    }

    @Override
    public String name() {
        return "processes";
    }

    @Override
    public void scrape(MetricPoints points) {
        points.sum(PROCESSES_COUNT, (long) operatingSystem.getProcessCount(), Map.of());
        points.sum(THREADS_COUNT, (long) operatingSystem.getThreadCount(), Map.of());
    }
}
