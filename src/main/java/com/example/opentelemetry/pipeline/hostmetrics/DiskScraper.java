package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.hardware.HWDiskStore;
import oshi.hardware.HardwareAbstractionLayer;

import java.util.Map;

class DiskScraper implements HostMetricsScraper {
    final Logger logger = LoggerFactory.getLogger(getClass());

    static final MetricDescriptor DISK_IO =
            MetricDescriptor.cumulativeSum("system.disk.io", "By", "Disk bytes transferred.", true);
    static final MetricDescriptor DISK_OPERATIONS =
            MetricDescriptor.cumulativeSum("system.disk.operations", "{operations}", "Disk operations count.", true);
    static final MetricDescriptor DISK_IO_TIME =
            MetricDescriptor.cumulativeSum("system.disk.io_time", "s", "Time disk spent activated.", true);

    private final HardwareAbstractionLayer hardware;

    DiskScraper(HardwareAbstractionLayer hardware) {
        this.hardware = hardware;
    }

    @Override
    public String name() {
        return "disk";
    }

    @Override
    public void scrape(MetricPoints points) {
        for (HWDiskStore disk : hardware.getDiskStores()) {
            String device = disk.getName();
            try {
                points.sum(DISK_IO, disk.getReadBytes(), Map.of("device", device, "direction", "read"));
                points.sum(DISK_IO, disk.getWriteBytes(), Map.of("device", device, "direction", "write"));
                points.sum(DISK_OPERATIONS, disk.getReads(), Map.of("device", device, "direction", "read"));
                points.sum(DISK_OPERATIONS, disk.getWrites(), Map.of("device", device, "direction", "write"));
                points.sum(DISK_IO_TIME, disk.getTransferTime() / 1000.0, Map.of("device", device));
            } catch (RuntimeException e) {
                logger.warn("failed to read disk counters of {}", device, e);
            }
        }
    }
}
