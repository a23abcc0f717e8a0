package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.NetworkIF;

import java.util.Map;

class NetworkScraper implements HostMetricsScraper {
    final Logger logger = LoggerFactory.getLogger(getClass());

    static final MetricDescriptor NETWORK_IO =
            MetricDescriptor.cumulativeSum("system.network.io", "By", "The number of bytes transmitted and received.", true);
    static final MetricDescriptor NETWORK_PACKETS =
            MetricDescriptor.cumulativeSum("system.network.packets", "{packets}", "The number of packets transferred.", true);
    static final MetricDescriptor NETWORK_ERRORS =
            MetricDescriptor.cumulativeSum("system.network.errors", "{errors}", "The number of errors encountered.", true);
    static final MetricDescriptor NETWORK_DROPPED =
            MetricDescriptor.cumulativeSum("system.network.dropped", "{packets}", "The number of packets dropped.", true);

    private final HardwareAbstractionLayer hardware;

    NetworkScraper(HardwareAbstractionLayer hardware) {
        this.hardware = hardware;
    }

    @Override
    public String name() {
        return "network";
    }

    @Override
    public void scrape(MetricPoints points) {
        for (NetworkIF networkIF : hardware.getNetworkIFs()) {
            String device = networkIF.getName();
            try {
                points.sum(NETWORK_IO, networkIF.getBytesRecv(), Map.of("device", device, "direction", "receive"));
                points.sum(NETWORK_IO, networkIF.getBytesSent(), Map.of("device", device, "direction", "transmit"));
                points.sum(NETWORK_PACKETS, networkIF.getPacketsRecv(), Map.of("device", device, "direction", "receive"));
                points.sum(NETWORK_PACKETS, networkIF.getPacketsSent(), Map.of("device", device, "direction", "transmit"));
                points.sum(NETWORK_ERRORS, networkIF.getInErrors(), Map.of("device", device, "direction", "receive"));
                points.sum(NETWORK_ERRORS, networkIF.getOutErrors(), Map.of("device", device, "direction", "transmit"));
                points.sum(NETWORK_DROPPED, networkIF.getInDrops(), Map.of("device", device, "direction", "receive"));
            } catch (RuntimeException e) {
                logger.warn("failed to read network counters of {}", device, e);
            }
        }
    }
}
