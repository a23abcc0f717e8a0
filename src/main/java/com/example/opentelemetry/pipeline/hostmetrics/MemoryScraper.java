package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import oshi.hardware.GlobalMemory;
import oshi.hardware.VirtualMemory;

import java.util.Map;

class MemoryScraper implements HostMetricsScraper {

    static final MetricDescriptor MEMORY_USAGE =
            MetricDescriptor.cumulativeSum("system.memory.usage", "By", "Bytes of memory in use.", false);
    static final MetricDescriptor MEMORY_UTILIZATION =
            MetricDescriptor.gauge("system.memory.utilization", "1", "Percentage of memory bytes in use.");
    static final MetricDescriptor PAGING_USAGE =
            MetricDescriptor.cumulativeSum("system.paging.usage", "By", "Swap (unix) or pagefile (windows) usage.", false);

    private final GlobalMemory memory;

    MemoryScraper(GlobalMemory memory) {
        this.memory = memory;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public void scrape(MetricPoints points) {
        long total = memory.getTotal();
        long free = memory.getAvailable();
        long used = total - free;
        points.sum(MEMORY_USAGE, used, Map.of("state", "used"));
        points.sum(MEMORY_USAGE, free, Map.of("state", "free"));
        if (total > 0) {
            points.gauge(MEMORY_UTILIZATION, (double) used / total, Map.of("state", "used"));
            points.gauge(MEMORY_UTILIZATION, (double) free / total, Map.of("state", "free"));
        }

        VirtualMemory virtualMemory = memory.getVirtualMemory();
        if (virtualMemory != null && virtualMemory.getSwapTotal() > 0) {
            long swapUsed = virtualMemory.getSwapUsed();
            points.sum(PAGING_USAGE, swapUsed, Map.of("state", "used"));
            points.sum(PAGING_USAGE, virtualMemory.getSwapTotal() - swapUsed, Map.of("state", "free"));
        }
    }
}
