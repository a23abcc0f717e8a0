package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.config.ConfigurationException;
import oshi.SystemInfo;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OperatingSystem;

import java.util.ArrayList;
import java.util.List;

public final class HostMetricsScrapers {

    private HostMetricsScrapers() {
    }

    public static List<HostMetricsScraper> create(List<String> names, SystemInfo systemInfo) {
        HardwareAbstractionLayer hardware = systemInfo.getHardware();
        OperatingSystem operatingSystem = systemInfo.getOperatingSystem();
        List<HostMetricsScraper> scrapers = new ArrayList<>();
        for (String name : names) {
            scrapers.add(switch (name) {
                case "cpu" -> new CpuScraper(hardware.getProcessor());
                case "memory" -> new MemoryScraper(hardware.getMemory());
                case "disk" -> new DiskScraper(hardware);
                case "filesystem" -> new FilesystemScraper(operatingSystem.getFileSystem());
                case "network" -> new NetworkScraper(hardware);
                case "load" -> new LoadScraper(hardware.getProcessor());
                case "processes" -> new ProcessesScraper(operatingSystem);
                default -> throw new ConfigurationException("Unknown host metrics scraper '" + name + "'");
            });
        }
        return scrapers;
    }
}
