package com.example.opentelemetry.pipeline.demo;

import com.example.opentelemetry.pipeline.resource.ResourceAttributesParser;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.net.PercentEscaper;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The settings an application uses to send telemetry to the collector, read from the standard
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}, {@code OTEL_EXPORTER_OTLP_PROTOCOL}, {@code OTEL_SERVICE_NAME} and
 * {@code OTEL_RESOURCE_ATTRIBUTES} variables.
 */
public final class ClientTelemetryOptions {

    static final String ENDPOINT_ENV = "OTEL_EXPORTER_OTLP_ENDPOINT";
    static final String PROTOCOL_ENV = "OTEL_EXPORTER_OTLP_PROTOCOL";
    static final String SERVICE_NAME_ENV = "OTEL_SERVICE_NAME";
    static final String RESOURCE_ATTRIBUTES_ENV = "OTEL_RESOURCE_ATTRIBUTES";

    private static final PercentEscaper ATTRIBUTE_VALUE_ESCAPER = new PercentEscaper("-._~!$&'()*+;:@/?", false);

    public enum Protocol {
        GRPC("grpc", 4317),
        HTTP_PROTOBUF("http/protobuf", 4318);

        private final String value;
        private final int defaultPort;

        Protocol(String value, int defaultPort) {
            this.value = value;
            this.defaultPort = defaultPort;
        }

        public String value() {
            return value;
        }

        public String defaultEndpoint() {
            return "http://localhost:" + defaultPort;
        }

        public static Protocol fromValue(String value) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(protocol -> protocol.value.equals(normalized))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported " + PROTOCOL_ENV + " '" + value
                            + "', expected grpc or http/protobuf"));
        }
    }

    private final URI endpoint;
    private final Protocol protocol;
    private final String serviceName;
    private final Map<String, String> resourceAttributes;

    private ClientTelemetryOptions(URI endpoint, Protocol protocol, String serviceName, Map<String, String> resourceAttributes) {
        this.endpoint = endpoint;
        this.protocol = protocol;
        this.serviceName = serviceName;
        this.resourceAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(resourceAttributes));
    }

    /**
     * @param defaultServiceName used when neither {@code OTEL_SERVICE_NAME} nor a {@code service.name} resource
     *                           attribute is set
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static ClientTelemetryOptions fromEnvironment(Map<String, String> env, String defaultServiceName) {
        String protocolValue = env.get(PROTOCOL_ENV);
        Protocol protocol = protocolValue == null || protocolValue.isBlank()
                ? Protocol.HTTP_PROTOBUF
                : Protocol.fromValue(protocolValue);

        String endpointValue = env.get(ENDPOINT_ENV);
        URI endpoint = parseEndpoint(endpointValue == null || endpointValue.isBlank() ? protocol.defaultEndpoint() : endpointValue.trim());

        Map<String, String> resourceAttributes = ResourceAttributesParser.parse(env.get(RESOURCE_ATTRIBUTES_ENV));
        String serviceName = env.get(SERVICE_NAME_ENV);
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = resourceAttributes.getOrDefault("service.name", defaultServiceName);
        }
        resourceAttributes.put("service.name", serviceName.trim());
        return new ClientTelemetryOptions(endpoint, protocol, serviceName.trim(), resourceAttributes);
    }

    static URI parseEndpoint(String value) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid " + ENDPOINT_ENV + " '" + value + "': " + e.getMessage(), e);
        }
        Preconditions.checkArgument("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()),
                "Invalid %s '%s', expected an http or https URL", ENDPOINT_ENV, value);
        Preconditions.checkArgument(uri.getHost() != null, "Invalid %s '%s', no host", ENDPOINT_ENV, value);
        return uri;
    }

    public URI endpoint() {
        return endpoint;
    }

    public Protocol protocol() {
        return protocol;
    }

    public String serviceName() {
        return serviceName;
    }

    public Map<String, String> resourceAttributes() {
        return resourceAttributes;
    }

    public Map<String, String> toAutoConfigureProperties(long metricExportIntervalMillis) {
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put("otel.exporter.otlp.endpoint", endpoint.toString());
        properties.put("otel.exporter.otlp.protocol", protocol.value());
        properties.put("otel.service.name", serviceName);
        properties.put("otel.resource.attributes", resourceAttributes.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + ATTRIBUTE_VALUE_ESCAPER.escape(entry.getValue()))
                .collect(Collectors.joining(",")));
        properties.put("otel.traces.exporter", "otlp");
        properties.put("otel.metrics.exporter", "otlp");
        properties.put("otel.logs.exporter", "none");
        properties.put("otel.metric.export.interval", Long.toString(metricExportIntervalMillis));
        return properties;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("endpoint", endpoint)
                .add("protocol", protocol.value())
                .add("serviceName", serviceName)
                .add("resourceAttributes", resourceAttributes)
                .toString();
    }
}
