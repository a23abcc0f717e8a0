package com.example.opentelemetry.pipeline.config;

import com.example.opentelemetry.pipeline.model.SignalType;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative collector configuration, bound from YAML by {@link ConfigLoader}. Instances are immutable and
 * shared read-only by every component for the lifetime of the process.
 */
public record PipelineConfig(ReceiversConfig receivers,
                             ProcessorsConfig processors,
                             Map<String, ExporterConfig> exporters,
                             ServiceConfig service,
                             ExtensionsConfig extensions) {

    public PipelineConfig {
        receivers = receivers == null ? new ReceiversConfig(null, null) : receivers;
        processors = processors == null ? new ProcessorsConfig(null, null, null) : processors;
        exporters = exporters == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(exporters));
        service = service == null ? new ServiceConfig(null, null, null) : service;
        extensions = extensions == null ? new ExtensionsConfig(null) : extensions;
    }

    /**
     * Names of the exporters the given signal is routed to, in declaration order. Empty when the signal has no
     * pipeline, in which case records of that signal are refused by the receivers.
     */
    public Set<String> exportersFor(SignalType signal) {
        PipelineRoute route = service.pipelines().get(signal.pipelineName());
        return route == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(route.exporters()));
    }

    public record ReceiversConfig(@Nullable OtlpReceiverConfig otlp, @Nullable HostMetricsConfig hostmetrics) {
    }

    public record OtlpReceiverConfig(@Nullable GrpcReceiverConfig grpc, @Nullable HttpReceiverConfig http) {
    }

    public record GrpcReceiverConfig(String endpoint, Integer maxInboundMessageSizeMiB) {
        /**
         * Largest size whose byte count still fits grpc-java's {@code int} limit.
         */
        public static final int MAX_INBOUND_MESSAGE_SIZE_MIB = 2047;

        public GrpcReceiverConfig {
            endpoint = endpoint == null ? "0.0.0.0:4317" : endpoint;
            maxInboundMessageSizeMiB = maxInboundMessageSizeMiB == null ? 4 : maxInboundMessageSizeMiB;
        }
    }

    public record HttpReceiverConfig(String endpoint, Integer maxRequestBodySizeMiB) {
        public HttpReceiverConfig {
            endpoint = endpoint == null ? "0.0.0.0:4318" : endpoint;
            maxRequestBodySizeMiB = maxRequestBodySizeMiB == null ? 20 : maxRequestBodySizeMiB;
        }
    }

    public record HostMetricsConfig(Duration collectionInterval, List<String> scrapers) {
        public static final List<String> ALL_SCRAPERS =
                List.of("cpu", "memory", "disk", "filesystem", "network", "load", "processes");

        public HostMetricsConfig {
            collectionInterval = collectionInterval == null ? Duration.ofSeconds(10) : collectionInterval;
            scrapers = scrapers == null ? ALL_SCRAPERS : List.copyOf(scrapers);
        }
    }

    public record ProcessorsConfig(BatchConfig batch,
                                   @JsonProperty("resourcedetection") ResourceDetectionConfig resourceDetection,
                                   QueueConfig queue) {
        public ProcessorsConfig {
            batch = batch == null ? new BatchConfig(null, null) : batch;
            resourceDetection = resourceDetection == null ? new ResourceDetectionConfig(null, null) : resourceDetection;
            queue = queue == null ? new QueueConfig(null, null) : queue;
        }
    }

    public record BatchConfig(Integer sendBatchSize, Duration timeout) {
        public BatchConfig {
            sendBatchSize = sendBatchSize == null ? 8192 : sendBatchSize;
            timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        }
    }

    public record ResourceDetectionConfig(List<String> detectors, Duration timeout) {
        public static final List<String> KNOWN_DETECTORS = List.of("env", "host", "os", "process", "container", "ec2");

        public ResourceDetectionConfig {
            detectors = detectors == null ? List.of("env", "host", "os", "process") : List.copyOf(detectors);
            timeout = timeout == null ? Duration.ofSeconds(2) : timeout;
        }
    }

    public record QueueConfig(Integer capacity, Duration enqueueTimeout) {
        public QueueConfig {
            capacity = capacity == null ? 1000 : capacity;
            enqueueTimeout = enqueueTimeout == null ? Duration.ofSeconds(1) : enqueueTimeout;
        }
    }

    public record ServiceConfig(Map<String, PipelineRoute> pipelines, Duration drainTimeout, Duration shutdownTimeout) {
        public static final Set<String> PIPELINE_NAMES = new LinkedHashSet<>(Arrays.stream(SignalType.values())
                .map(SignalType::pipelineName)
                .toList());

        public ServiceConfig {
            pipelines = pipelines == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
            drainTimeout = drainTimeout == null ? Duration.ofSeconds(5) : drainTimeout;
            shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(10) : shutdownTimeout;
        }
    }

    public record PipelineRoute(List<String> exporters) {
        public PipelineRoute {
            exporters = exporters == null ? List.of() : List.copyOf(exporters);
        }
    }

    public record ExtensionsConfig(HealthCheckConfig healthCheck) {
        public ExtensionsConfig {
            healthCheck = healthCheck == null ? new HealthCheckConfig(null, null) : healthCheck;
        }
    }

    public record HealthCheckConfig(Boolean enabled, String endpoint) {
        public HealthCheckConfig {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            endpoint = endpoint == null ? "0.0.0.0:13133" : endpoint;
        }
    }
}
