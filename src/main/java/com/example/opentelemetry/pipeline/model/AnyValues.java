package com.example.opentelemetry.pipeline.model;

import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.KeyValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class AnyValues {

    private AnyValues() {
    }

    public static AnyValue of(String value) {
        return AnyValue.newBuilder().setStringValue(value).build();
    }

    public static AnyValue of(long value) {
        return AnyValue.newBuilder().setIntValue(value).build();
    }

    public static AnyValue of(double value) {
        return AnyValue.newBuilder().setDoubleValue(value).build();
    }

    public static AnyValue of(boolean value) {
        return AnyValue.newBuilder().setBoolValue(value).build();
    }

    /**
     * Converts an OTLP key/value list to an ordered map. When a key is repeated the first occurrence wins.
     */
    public static Map<String, AnyValue> toMap(List<KeyValue> keyValues) {
        Map<String, AnyValue> result = new LinkedHashMap<>();
        for (KeyValue keyValue : keyValues) {
            result.putIfAbsent(keyValue.getKey(), keyValue.getValue());
        }
        return result;
    }

    public static List<KeyValue> toKeyValues(Map<String, AnyValue> attributes) {
        return attributes.entrySet().stream()
                .map(entry -> KeyValue.newBuilder().setKey(entry.getKey()).setValue(entry.getValue()).build())
                .collect(Collectors.toList());
    }

    public static String toDisplayString(AnyValue value) {
        return switch (value.getValueCase()) {
            case STRING_VALUE -> value.getStringValue();
            case BOOL_VALUE -> Boolean.toString(value.getBoolValue());
            case INT_VALUE -> Long.toString(value.getIntValue());
            case DOUBLE_VALUE -> Double.toString(value.getDoubleValue());
            case ARRAY_VALUE -> value.getArrayValue().getValuesList().stream()
                    .map(AnyValues::toDisplayString)
                    .collect(Collectors.joining(",", "[", "]"));
            case KVLIST_VALUE -> value.getKvlistValue().getValuesList().stream()
                    .map(kv -> kv.getKey() + "=" + toDisplayString(kv.getValue()))
                    .collect(Collectors.joining(",", "{", "}"));
            case BYTES_VALUE -> value.getBytesValue().size() + " bytes";
            case VALUE_NOT_SET -> "";
        };
    }
}
