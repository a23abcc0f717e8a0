package com.example.opentelemetry.pipeline.model;

import com.google.common.base.MoreObjects;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.resource.v1.Resource;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of attributes identifying the entity that produced telemetry (host, service, process).
 * <p>
 * The collector resolves one instance for its own process at startup; receivers build one per OTLP
 * {@code Resource*} envelope from what the caller declared.
 */
public final class TelemetryResource {

    public static final TelemetryResource EMPTY = new TelemetryResource(Collections.emptyMap(), 0);

    private final Map<String, AnyValue> attributes;
    private final int droppedAttributesCount;
    private final Resource proto;

    private TelemetryResource(Map<String, AnyValue> attributes, int droppedAttributesCount) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.droppedAttributesCount = droppedAttributesCount;
        this.proto = Resource.newBuilder()
                .addAllAttributes(AnyValues.toKeyValues(this.attributes))
                .setDroppedAttributesCount(droppedAttributesCount)
                .build();
    }

    public static TelemetryResource fromProto(Resource resource) {
        if (resource.getAttributesCount() == 0 && resource.getDroppedAttributesCount() == 0) {
            return EMPTY;
        }
        return new TelemetryResource(AnyValues.toMap(resource.getAttributesList()), resource.getDroppedAttributesCount());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, AnyValue> attributes() {
        return attributes;
    }

    public int droppedAttributesCount() {
        return droppedAttributesCount;
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    @Nullable
    public String getString(String key) {
        AnyValue value = attributes.get(key);
        return value == null ? null : AnyValues.toDisplayString(value);
    }

    @Nullable
    public String getString(AttributeKey<?> key) {
        return getString(key.getKey());
    }

    /**
     * Returns a resource holding all the attributes of this resource plus the attributes of {@code defaults}
     * whose keys this resource does not define. Values of this resource are never overwritten.
     */
    public TelemetryResource withDefaults(TelemetryResource defaults) {
        if (defaults.isEmpty()) {
            return this;
        }
        if (this.isEmpty() && droppedAttributesCount == 0) {
            return defaults;
        }
        Map<String, AnyValue> merged = new LinkedHashMap<>(attributes);
        defaults.attributes.forEach(merged::putIfAbsent);
        return new TelemetryResource(merged, droppedAttributesCount);
    }

    public Resource toProto() {
        return proto;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TelemetryResource that = (TelemetryResource) o;
        return droppedAttributesCount == that.droppedAttributesCount && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, droppedAttributesCount);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("attributes", attributes.keySet())
                .add("droppedAttributesCount", droppedAttributesCount)
                .toString();
    }

    public static final class Builder {
        private final Map<String, AnyValue> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, AnyValue value) {
            attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, AnyValues.of(value));
        }

        public Builder put(AttributeKey<String> key, String value) {
            return put(key.getKey(), AnyValues.of(value));
        }

        public Builder put(AttributeKey<Long> key, long value) {
            return put(key.getKey(), AnyValues.of(value));
        }

        public Builder putIfAbsent(String key, AnyValue value) {
            attributes.putIfAbsent(key, value);
            return this;
        }

        public Builder putAllIfAbsent(TelemetryResource resource) {
            resource.attributes().forEach(attributes::putIfAbsent);
            return this;
        }

        public TelemetryResource build() {
            return attributes.isEmpty() ? EMPTY : new TelemetryResource(attributes, 0);
        }
    }
}
