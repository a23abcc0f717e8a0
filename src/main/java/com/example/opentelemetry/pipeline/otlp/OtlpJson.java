package com.example.opentelemetry.pipeline.otlp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.BaseEncoding;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * OTLP/JSON support. OTLP/JSON differs from the canonical protobuf JSON mapping in one point handled here:
 * trace and span identifiers are hex encoded instead of base64.
 */
public final class OtlpJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> ID_FIELDS = Set.of("traceId", "spanId", "parentSpanId", "trace_id", "span_id", "parent_span_id");
    private static final Pattern HEX_ID = Pattern.compile("[0-9a-fA-F]{16}|[0-9a-fA-F]{32}");

    private static final JsonFormat.Parser PARSER = JsonFormat.parser().ignoringUnknownFields();
    private static final JsonFormat.Printer PRINTER = JsonFormat.printer().omittingInsignificantWhitespace();

    private OtlpJson() {
    }

    public static <B extends Message.Builder> B merge(byte[] json, B builder) throws MalformedPayloadException {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new MalformedPayloadException("Request body is not valid JSON: " + e.getMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedPayloadException("Request body must be a JSON object");
        }
        hexIdsToBase64(tree);
        try {
            PARSER.merge(MAPPER.writeValueAsString(tree), builder);
        } catch (InvalidProtocolBufferException | JsonProcessingException e) {
            throw new MalformedPayloadException("Request body is not a valid OTLP/JSON payload: " + e.getMessage(), e);
        }
        return builder;
    }

    public static String print(Message message) {
        try {
            return PRINTER.print(message);
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalStateException("Cannot print " + message.getDescriptorForType().getFullName() + " as JSON", e);
        }
    }

    private static void hexIdsToBase64(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (ID_FIELDS.contains(field.getKey()) && value.isTextual() && HEX_ID.matcher(value.textValue()).matches()) {
                    byte[] id = BaseEncoding.base16().lowerCase().decode(value.textValue().toLowerCase());
                    field.setValue(object.textNode(BaseEncoding.base64().encode(id)));
                } else {
                    hexIdsToBase64(value);
                }
            }
        } else if (node instanceof ArrayNode array) {
            array.forEach(OtlpJson::hexIdsToBase64);
        }
    }
}
