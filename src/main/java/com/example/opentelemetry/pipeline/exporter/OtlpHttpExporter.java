package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.config.ExporterConfig;
import com.example.opentelemetry.pipeline.model.ExportResult;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.otlp.OtlpEncoder;
import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import org.apache.http.Header;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.DateUtils;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class OtlpHttpExporter implements TelemetryExporter {

    static final ContentType PROTOBUF = ContentType.create("application/x-protobuf");
    static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 502, 503, 504);

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final ExporterConfig config;
    private final CloseableHttpClient httpClient;

    public OtlpHttpExporter(String name, ExporterConfig config) {
        this(name, config, newHttpClient(config.timeout()));
    }

    @VisibleForTesting
    OtlpHttpExporter(String name, ExporterConfig config, CloseableHttpClient httpClient) {
        this.name = Objects.requireNonNull(name);
        this.config = Objects.requireNonNull(config);
        this.httpClient = Objects.requireNonNull(httpClient);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExportResult export(SignalType signal, List<TelemetryRecord> records) {
        String endpoint = config.endpointFor(signal);
        if (endpoint == null) {
            return ExportResult.permanent("no endpoint configured for " + signal.pipelineName());
        }
        Message request = switch (signal) {
            case METRIC -> OtlpEncoder.encodeMetrics(records);
            case LOG -> OtlpEncoder.encodeLogs(records);
            case SPAN -> OtlpEncoder.encodeSpans(records);
        };
        HttpPost post = new HttpPost(endpoint);
        config.headers().forEach(post::setHeader);
        post.setEntity(new ByteArrayEntity(request.toByteArray(), PROTOBUF));

        try (CloseableHttpResponse response = httpClient.execute(post)) {
            int statusCode = response.getStatusLine().getStatusCode();
            byte[] body = response.getEntity() == null ? new byte[0] : EntityUtils.toByteArray(response.getEntity());
            if (statusCode >= 200 && statusCode < 300) {
                return ExportResult.success();
            }
            String message = endpoint + " returned HTTP " + statusCode + describe(body);
            if (RETRYABLE_STATUS_CODES.contains(statusCode)) {
                return ExportResult.retryable(message, retryAfter(response.getFirstHeader(HttpHeaders.RETRY_AFTER)));
            }
            return ExportResult.permanent(message);
        } catch (IOException e) {
            logger.debug("Failed to send {} {} record(s) to {}", records.size(), signal.pipelineName(), endpoint, e);
            return ExportResult.retryable(endpoint + " unreachable: " + e);
        }
    }

    @Override
    public void shutdown() {
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.warn("Failed to close HTTP client of exporter '{}'", name, e);
        }
    }

    private static String describe(byte[] body) {
        if (body.length == 0) {
            return "";
        }
        try {
            com.google.rpc.Status status = com.google.rpc.Status.parseFrom(body);
            return status.getMessage().isEmpty() ? "" : ": " + status.getMessage();
        } catch (InvalidProtocolBufferException e) {
            return "";
        }
    }

    /**
     * Parses a {@code Retry-After} header holding either a number of seconds or an HTTP date.
     */
    @Nullable
    static Duration retryAfter(@Nullable Header header) {
        if (header == null || header.getValue() == null) {
            return null;
        }
        String value = header.getValue().trim();
        try {
            long seconds = Long.parseLong(value);
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            Date date = DateUtils.parseDate(value);
            if (date == null) {
                return null;
            }
            long millis = date.getTime() - System.currentTimeMillis();
            return millis <= 0 ? Duration.ZERO : Duration.ofMillis(millis);
        }
    }

    static CloseableHttpClient newHttpClient(Duration timeout) {
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();
    }
}
