package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.AnyValues;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

class EnvResourceDetector implements ResourceDetector {
    final Logger logger = LoggerFactory.getLogger(getClass());

    static final String OTEL_RESOURCE_ATTRIBUTES = "OTEL_RESOURCE_ATTRIBUTES";
    static final String OTEL_SERVICE_NAME = "OTEL_SERVICE_NAME";

    private final Map<String, String> env;

    EnvResourceDetector(Map<String, String> env) {
        this.env = env;
    }

    @Override
    public String name() {
        return "env";
    }

    @Override
    public TelemetryResource detect() {
        TelemetryResource.Builder builder = TelemetryResource.builder();
        String serviceName = env.get(OTEL_SERVICE_NAME);
        if (serviceName != null && !serviceName.isBlank()) {
            builder.put(ResourceAttributes.SERVICE_NAME, serviceName.trim());
        }
        try {
            ResourceAttributesParser.parse(env.get(OTEL_RESOURCE_ATTRIBUTES))
                    .forEach((key, value) -> builder.putIfAbsent(key, AnyValues.of(value)));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {}: {}", OTEL_RESOURCE_ATTRIBUTES, e.getMessage());
        }
        return builder.build();
    }
}
