package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.config.ConfigurationException;
import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import com.example.opentelemetry.pipeline.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the collector's resource once at startup.
 * <p>
 * Detectors run concurrently under a single deadline. A detector that fails or misses the deadline contributes
 * nothing. Results are merged in the configured order; the first detector to set a key wins.
 */
public class ResourceResolver {
    final Logger logger = LoggerFactory.getLogger(getClass());

    private final List<ResourceDetector> detectors;
    private final Duration timeout;

    public ResourceResolver(List<ResourceDetector> detectors, Duration timeout) {
        this.detectors = List.copyOf(detectors);
        this.timeout = timeout;
    }

    public static ResourceResolver fromConfig(PipelineConfig.ResourceDetectionConfig config, Map<String, String> env) {
        List<ResourceDetector> detectors = new ArrayList<>();
        for (String name : config.detectors()) {
            detectors.add(switch (name) {
                case "env" -> new EnvResourceDetector(env);
                case "host" -> new HostResourceDetector(env);
                case "os" -> new OsResourceDetector();
                case "process" -> new ProcessResourceDetector();
                case "container" -> new ContainerResourceDetector();
                case "ec2" -> new Ec2ResourceDetector(config.timeout());
                default -> throw new ConfigurationException("Unknown resource detector '" + name + "'");
            });
        }
        return new ResourceResolver(detectors, config.timeout());
    }

    public TelemetryResource resolve() throws InterruptedException {
        ExecutorService executor = Executors.newCachedThreadPool(Threads.daemonThreadFactory("resource-detector", true, logger));
        try {
            Map<ResourceDetector, CompletableFuture<TelemetryResource>> futures = new LinkedHashMap<>();
            for (ResourceDetector detector : detectors) {
                futures.put(detector, CompletableFuture.supplyAsync(() -> {
                    try {
                        return detector.detect();
                    } catch (Exception e) {
                        throw new CompletionException(e);
                    }
                }, executor));
            }

            long deadline = System.nanoTime() + timeout.toNanos();
            TelemetryResource.Builder builder = TelemetryResource.builder();
            for (Map.Entry<ResourceDetector, CompletableFuture<TelemetryResource>> entry : futures.entrySet()) {
                String name = entry.getKey().name();
                try {
                    TelemetryResource detected = entry.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                    logger.debug("Detector '{}' found {}", name, detected.attributes().keySet());
                    builder.putAllIfAbsent(detected);
                } catch (TimeoutException e) {
                    entry.getValue().cancel(true);
                    logger.warn("Resource detector '{}' did not complete within {}, skipping it", name, timeout);
                } catch (ExecutionException e) {
                    logger.warn("Resource detector '{}' failed, skipping it: {}", name, e.getCause().toString());
                    logger.debug("Resource detector '{}' failure", name, e.getCause());
                }
            }
            TelemetryResource resource = builder.build();
            logger.info("Resolved resource {}", resource);
            return resource;
        } finally {
            executor.shutdownNow();
        }
    }
}
