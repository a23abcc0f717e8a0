package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.software.os.FileSystem;
import oshi.software.os.OSFileStore;

import java.util.Map;

/**
 * {@code system.filesystem.usage} per mount point and state ({@code used}, {@code free}, {@code reserved}) and
 * {@code system.filesystem.utilization} per mount point. Stores reporting no capacity are skipped.
 */
class FilesystemScraper implements HostMetricsScraper {
    final Logger logger = LoggerFactory.getLogger(getClass());

    static final MetricDescriptor FILESYSTEM_USAGE =
            MetricDescriptor.cumulativeSum("system.filesystem.usage", "By", "Filesystem bytes used.", false);
    static final MetricDescriptor FILESYSTEM_UTILIZATION =
            MetricDescriptor.gauge("system.filesystem.utilization", "1", "Fraction of filesystem bytes used.");

    private final FileSystem fileSystem;

    FilesystemScraper(FileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public void scrape(MetricPoints points) {
        for (OSFileStore store : fileSystem.getFileStores()) {
            try {
                long total = store.getTotalSpace();
                if (total <= 0) {
                    continue;
                }
                long free = store.getFreeSpace();
                long usable = store.getUsableSpace();
                long used = total - free;
                Map<String, String> base = Map.of(
                        "device", store.getVolume() == null ? store.getName() : store.getVolume(),
                        "mountpoint", store.getMount(),
                        "type", store.getType());
                points.sum(FILESYSTEM_USAGE, used, withState(base, "used"));
                points.sum(FILESYSTEM_USAGE, usable, withState(base, "free"));
                points.sum(FILESYSTEM_USAGE, Math.max(0, free - usable), withState(base, "reserved"));
                points.gauge(FILESYSTEM_UTILIZATION, (double) used / total, base);
            } catch (RuntimeException e) {
                logger.warn("failed to read filesystem usage of {}", store.getMount(), e);
            }
        }
    }

    private static Map<String, String> withState(Map<String, String> base, String state) {
        return Map.of("device", base.get("device"),
                "mountpoint", base.get("mountpoint"),
                "type", base.get("type"),
                "state", state);
    }
}
