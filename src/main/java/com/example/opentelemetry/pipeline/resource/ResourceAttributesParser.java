package com.example.opentelemetry.pipeline.resource;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the {@code OTEL_RESOURCE_ATTRIBUTES} format: comma separated {@code key=value} pairs whose values may be
 * percent-encoded.
 */
public final class ResourceAttributesParser {

    private ResourceAttributesParser() {
    }

    public static Map<String, String> parse(String attributes) {
        Map<String, String> result = new LinkedHashMap<>();
        if (attributes == null || attributes.isBlank()) {
            return result;
        }
        for (String entry : attributes.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            int separator = entry.indexOf('=');
            if (separator < 0) {
                throw new IllegalArgumentException("Invalid resource attribute '" + entry.trim() + "', expected key=value");
            }
            String key = entry.substring(0, separator).trim();
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Invalid resource attribute '" + entry.trim() + "', empty key");
            }
            String value = entry.substring(separator + 1).trim();
            result.put(key, URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8));
        }
        return result;
    }
}
