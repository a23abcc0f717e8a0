package com.example.opentelemetry.pipeline.config;

import com.example.opentelemetry.pipeline.config.ExporterConfig.ExporterType;
import com.example.opentelemetry.pipeline.config.PipelineConfig.GrpcReceiverConfig;
import com.example.opentelemetry.pipeline.config.PipelineConfig.HostMetricsConfig;
import com.example.opentelemetry.pipeline.config.PipelineConfig.OtlpReceiverConfig;
import com.example.opentelemetry.pipeline.config.PipelineConfig.ResourceDetectionConfig;
import com.example.opentelemetry.pipeline.config.PipelineConfig.ServiceConfig;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.google.common.net.HostAndPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

class ConfigValidator {

    private final List<String> errors = new ArrayList<>();

    void validate(PipelineConfig config) {
        validateReceivers(config.receivers());
        validateProcessors(config.processors());
        validateExporters(config);
        validateService(config);
        if (config.extensions().healthCheck().enabled()) {
            checkHostPort("extensions.healthCheck.endpoint", config.extensions().healthCheck().endpoint());
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration:\n  - " + String.join("\n  - ", errors));
        }
    }

    private void validateReceivers(PipelineConfig.ReceiversConfig receivers) {
        OtlpReceiverConfig otlp = receivers.otlp();
        boolean hasOtlp = otlp != null && (otlp.grpc() != null || otlp.http() != null);
        if (!hasOtlp && receivers.hostmetrics() == null) {
            errors.add("receivers is required: configure receivers.otlp.grpc, receivers.otlp.http or receivers.hostmetrics");
        }
        if (otlp != null && otlp.grpc() != null) {
            checkHostPort("receivers.otlp.grpc.endpoint", otlp.grpc().endpoint());
            checkPositive("receivers.otlp.grpc.maxInboundMessageSizeMiB", otlp.grpc().maxInboundMessageSizeMiB());
            Integer maxInboundMessageSizeMiB = otlp.grpc().maxInboundMessageSizeMiB();
            if (maxInboundMessageSizeMiB != null && maxInboundMessageSizeMiB > GrpcReceiverConfig.MAX_INBOUND_MESSAGE_SIZE_MIB) {
                errors.add("receivers.otlp.grpc.maxInboundMessageSizeMiB must not exceed "
                        + GrpcReceiverConfig.MAX_INBOUND_MESSAGE_SIZE_MIB);
            }
        }
        if (otlp != null && otlp.http() != null) {
            checkHostPort("receivers.otlp.http.endpoint", otlp.http().endpoint());
            checkPositive("receivers.otlp.http.maxRequestBodySizeMiB", otlp.http().maxRequestBodySizeMiB());
        }
        HostMetricsConfig hostMetrics = receivers.hostmetrics();
        if (hostMetrics != null) {
            checkPositive("receivers.hostmetrics.collectionInterval", hostMetrics.collectionInterval());
            for (String scraper : hostMetrics.scrapers()) {
                if (!HostMetricsConfig.ALL_SCRAPERS.contains(scraper)) {
                    errors.add("receivers.hostmetrics.scrapers: unknown scraper '" + scraper + "', expected one of "
                            + HostMetricsConfig.ALL_SCRAPERS);
                }
            }
        }
    }

    private void validateProcessors(PipelineConfig.ProcessorsConfig processors) {
        checkPositive("processors.batch.sendBatchSize", processors.batch().sendBatchSize());
        checkPositive("processors.batch.timeout", processors.batch().timeout());
        checkPositive("processors.queue.capacity", processors.queue().capacity());
        if (processors.queue().enqueueTimeout().isNegative()) {
            errors.add("processors.queue.enqueueTimeout must not be negative");
        }
        checkPositive("processors.resourcedetection.timeout", processors.resourceDetection().timeout());
        for (String detector : processors.resourceDetection().detectors()) {
            if (!ResourceDetectionConfig.KNOWN_DETECTORS.contains(detector)) {
                errors.add("processors.resourcedetection.detectors: unknown detector '" + detector + "', expected one of "
                        + ResourceDetectionConfig.KNOWN_DETECTORS);
            }
        }
    }

    private void validateExporters(PipelineConfig config) {
        if (config.exporters().isEmpty()) {
            errors.add("exporters is required: declare at least one exporter");
        }
        for (Map.Entry<String, ExporterConfig> entry : config.exporters().entrySet()) {
            String path = "exporters." + entry.getKey();
            ExporterConfig exporter = entry.getValue();
            if (exporter == null) {
                errors.add(path + " must not be empty");
                continue;
            }
            if (exporter.type() == null) {
                errors.add(path + ".type is required (otlp, otlphttp or logging)");
                continue;
            }
            checkPositive(path + ".timeout", exporter.timeout());
            checkPositive(path + ".queueSize", exporter.queueSize());
            checkPositive(path + ".retry.maxAttempts", exporter.retry().maxAttempts());
            checkPositive(path + ".retry.initialInterval", exporter.retry().initialInterval());
            if (exporter.retry().maxInterval().compareTo(exporter.retry().initialInterval()) < 0) {
                errors.add(path + ".retry.maxInterval must not be shorter than retry.initialInterval");
            }
            if (exporter.retry().multiplier() < 1.0) {
                errors.add(path + ".retry.multiplier must be at least 1.0");
            }
            if (exporter.type() == ExporterType.LOGGING) {
                continue;
            }
            for (SignalType signal : SignalType.values()) {
                if (!config.exportersFor(signal).contains(entry.getKey())) {
                    continue;
                }
                String endpoint = exporter.endpointFor(signal);
                if (endpoint == null || endpoint.isBlank()) {
                    errors.add(path + ".endpoint is required (or " + signal.pipelineName() + " specific endpoint) because the "
                            + signal.pipelineName() + " pipeline uses this exporter");
                } else if (exporter.type() == ExporterType.OTLP_HTTP
                        && !endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
                    errors.add(path + ": " + signal.pipelineName() + " endpoint '" + endpoint + "' must be an http:// or https:// URL");
                }
            }
        }
    }

    private void validateService(PipelineConfig config) {
        ServiceConfig service = config.service();
        if (service.pipelines().isEmpty()) {
            errors.add("service.pipelines is required: declare at least one of " + ServiceConfig.PIPELINE_NAMES);
        }
        for (Map.Entry<String, PipelineConfig.PipelineRoute> entry : service.pipelines().entrySet()) {
            String path = "service.pipelines." + entry.getKey();
            if (!ServiceConfig.PIPELINE_NAMES.contains(entry.getKey())) {
                errors.add(path + ": unknown pipeline, expected one of " + ServiceConfig.PIPELINE_NAMES);
                continue;
            }
            if (entry.getValue() == null || entry.getValue().exporters().isEmpty()) {
                errors.add(path + ".exporters is required");
                continue;
            }
            for (String exporter : entry.getValue().exporters()) {
                if (!config.exporters().containsKey(exporter)) {
                    errors.add(path + ".exporters references undeclared exporter '" + exporter + "'");
                }
            }
        }
        checkPositive("service.drainTimeout", service.drainTimeout());
        checkPositive("service.shutdownTimeout", service.shutdownTimeout());
    }

    private void checkHostPort(String path, String endpoint) {
        try {
            HostAndPort hostAndPort = HostAndPort.fromString(endpoint);
            if (!hostAndPort.hasPort()) {
                errors.add(path + " '" + endpoint + "' must include a port");
            }
        } catch (IllegalArgumentException e) {
            errors.add(path + " '" + endpoint + "' is not a valid host:port");
        }
    }

    private void checkPositive(String path, Integer value) {
        if (value == null || value <= 0) {
            errors.add(path + " must be greater than 0");
        }
    }

    private void checkPositive(String path, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(path + " must be a positive duration");
        }
    }
}
