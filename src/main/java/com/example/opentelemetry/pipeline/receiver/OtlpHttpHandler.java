package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.otlp.MalformedPayloadException;
import com.example.opentelemetry.pipeline.otlp.OtlpJson;
import com.example.opentelemetry.pipeline.processor.BackpressureException;
import com.google.common.io.ByteStreams;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import io.grpc.Status;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Serves {@code POST /v1/metrics}, {@code /v1/logs} and {@code /v1/traces} with binary protobuf or JSON bodies,
 * optionally gzip compressed. Errors are answered with a {@code google.rpc.Status} body encoded like the
 * request.
 */
public final class OtlpHttpHandler extends AbstractHandler {
    static final String TRANSPORT = "http";
    static final String PROTOBUF = "application/x-protobuf";
    static final String JSON = "application/json";

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final TelemetryIngest ingest;
    private final long maxRequestBodyBytes;

    public OtlpHttpHandler(TelemetryIngest ingest, long maxRequestBodyBytes) {
        this.ingest = ingest;
        this.maxRequestBodyBytes = maxRequestBodyBytes;
    }

    @Override
    public void handle(String target, Request baseRequest, HttpServletRequest request,
                       HttpServletResponse response) throws IOException {
        baseRequest.setHandled(true);
        SignalType signal = switch (target) {
            case "/v1/metrics" -> SignalType.METRIC;
            case "/v1/logs" -> SignalType.LOG;
            case "/v1/traces" -> SignalType.SPAN;
            default -> null;
        };
        String contentType = mediaType(request.getContentType());
        String responseType = JSON.equals(contentType) ? JSON : PROTOBUF;
        if (signal == null || !ingest.accepts(signal)) {
            writeStatus(response, responseType, HttpServletResponse.SC_NOT_FOUND, Status.Code.NOT_FOUND, "no such endpoint " + target);
            return;
        }
        if (!HttpMethod.POST.is(request.getMethod())) {
            response.setHeader(HttpHeader.ALLOW.asString(), HttpMethod.POST.asString());
            writeStatus(response, responseType, HttpServletResponse.SC_METHOD_NOT_ALLOWED, Status.Code.UNIMPLEMENTED,
                    request.getMethod() + " not allowed, use POST");
            return;
        }
        if (!PROTOBUF.equals(contentType) && !JSON.equals(contentType)) {
            writeStatus(response, PROTOBUF, 415, Status.Code.INVALID_ARGUMENT,
                    "unsupported content type " + request.getContentType() + ", expected " + PROTOBUF + " or " + JSON);
            return;
        }
        if (request.getContentLengthLong() > maxRequestBodyBytes) {
            writeStatus(response, responseType, 413, Status.Code.INVALID_ARGUMENT, "request body larger than " + maxRequestBodyBytes + " bytes");
            return;
        }

        long receivedNanoTime = System.nanoTime();
        List<TelemetryRecord> records;
        try {
            byte[] body = readBody(request);
            if (body.length > maxRequestBodyBytes) {
                writeStatus(response, responseType, 413, Status.Code.INVALID_ARGUMENT, "request body larger than " + maxRequestBodyBytes + " bytes");
                return;
            }
            records = decode(signal, contentType, body, receivedNanoTime);
        } catch (MalformedPayloadException e) {
            logger.debug("Reject {} request: {}", signal.pipelineName(), e.getMessage());
            writeStatus(response, responseType, HttpServletResponse.SC_BAD_REQUEST, Status.Code.INVALID_ARGUMENT, e.getMessage());
            return;
        }

        try {
            ingest.submit(signal, records, TRANSPORT);
        } catch (BackpressureException e) {
            response.setHeader(HttpHeader.RETRY_AFTER.asString(), Long.toString(ingest.retryAfter().toSeconds()));
            writeStatus(response, responseType, HttpServletResponse.SC_SERVICE_UNAVAILABLE, Status.Code.UNAVAILABLE, e.getMessage());
            return;
        }
        Message success = switch (signal) {
            case METRIC -> ExportMetricsServiceResponse.getDefaultInstance();
            case LOG -> ExportLogsServiceResponse.getDefaultInstance();
            case SPAN -> ExportTraceServiceResponse.getDefaultInstance();
        };
        write(response, responseType, HttpServletResponse.SC_OK, success);
    }

    private byte[] readBody(HttpServletRequest request) throws IOException, MalformedPayloadException {
        String encoding = request.getHeader(HttpHeader.CONTENT_ENCODING.asString());
        InputStream in = request.getInputStream();
        boolean gzip = false;
        if (encoding != null && !encoding.isBlank() && !"identity".equalsIgnoreCase(encoding.trim())) {
            if (!"gzip".equalsIgnoreCase(encoding.trim())) {
                throw new MalformedPayloadException("unsupported content encoding " + encoding);
            }
            gzip = true;
            try {
                in = new GZIPInputStream(in);
            } catch (IOException e) {
                throw new MalformedPayloadException("invalid gzip body: " + e.getMessage(), e);
            }
        }
        try (InputStream body = ByteStreams.limit(in, maxRequestBodyBytes + 1)) {
            return ByteStreams.toByteArray(body);
        } catch (IOException e) {
            // An empty or truncated gzip stream ends with EOFException, not ZipException
            if (gzip) {
                throw new MalformedPayloadException("invalid gzip body: " + e.getMessage(), e);
            }
            throw e;
        }
    }

    private List<TelemetryRecord> decode(SignalType signal, String contentType, byte[] body, long receivedNanoTime)
            throws MalformedPayloadException {
        boolean json = JSON.equals(contentType);
        try {
            return switch (signal) {
                case METRIC -> ingest.decoder().decodeMetrics(json
                        ? OtlpJson.merge(body, ExportMetricsServiceRequest.newBuilder()).build()
                        : ExportMetricsServiceRequest.parseFrom(body), receivedNanoTime);
                case LOG -> ingest.decoder().decodeLogs(json
                        ? OtlpJson.merge(body, ExportLogsServiceRequest.newBuilder()).build()
                        : ExportLogsServiceRequest.parseFrom(body), receivedNanoTime);
                case SPAN -> ingest.decoder().decodeTraces(json
                        ? OtlpJson.merge(body, ExportTraceServiceRequest.newBuilder()).build()
                        : ExportTraceServiceRequest.parseFrom(body), receivedNanoTime);
            };
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedPayloadException("invalid protobuf body: " + e.getMessage(), e);
        }
    }

    private static void writeStatus(HttpServletResponse response, String contentType, int httpStatus,
                                    Status.Code code, String message) throws IOException {
        com.google.rpc.Status status = com.google.rpc.Status.newBuilder()
                .setCode(code.value())
                .setMessage(message)
                .build();
        write(response, contentType, httpStatus, status);
    }

    private static void write(HttpServletResponse response, String contentType, int httpStatus, Message message) throws IOException {
        byte[] body = JSON.equals(contentType)
                ? OtlpJson.print(message).getBytes(StandardCharsets.UTF_8)
                : message.toByteArray();
        response.setStatus(httpStatus);
        response.setContentType(contentType);
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }

    static String mediaType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semicolon = contentType.indexOf(';');
        String mediaType = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return mediaType.trim().toLowerCase(Locale.ROOT);
    }
}
