package com.example.opentelemetry.pipeline.exporter;

import com.example.opentelemetry.pipeline.config.ExporterConfig;
import com.example.opentelemetry.pipeline.model.ExportResult;
import com.example.opentelemetry.pipeline.model.SignalType;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.otlp.OtlpEncoder;
import com.google.common.net.HostAndPort;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import io.grpc.stub.MetadataUtils;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.logs.v1.LogsServiceGrpc;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import io.opentelemetry.proto.collector.metrics.v1.MetricsServiceGrpc;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.TraceServiceGrpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

public class OtlpGrpcExporter implements TelemetryExporter {

    static final Set<Status.Code> RETRYABLE_CODES = EnumSet.of(
            Status.Code.CANCELLED,
            Status.Code.DEADLINE_EXCEEDED,
            Status.Code.RESOURCE_EXHAUSTED,
            Status.Code.ABORTED,
            Status.Code.OUT_OF_RANGE,
            Status.Code.UNAVAILABLE,
            Status.Code.DATA_LOSS);

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final ExporterConfig config;
    private final Metadata headers;
    private final Function<String, ManagedChannel> channelFactory;
    private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();

    public OtlpGrpcExporter(String name, ExporterConfig config) {
        this(name, config, OtlpGrpcExporter::newChannel);
    }

    public OtlpGrpcExporter(String name, ExporterConfig config, Function<String, ManagedChannel> channelFactory) {
        this.name = Objects.requireNonNull(name);
        this.config = Objects.requireNonNull(config);
        this.channelFactory = Objects.requireNonNull(channelFactory);
        this.headers = new Metadata();
        config.headers().forEach((key, value) ->
                headers.put(Metadata.Key.of(key.toLowerCase(Locale.ROOT), Metadata.ASCII_STRING_MARSHALLER), value));
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
        ManagedChannel channel = channels.computeIfAbsent(endpoint, channelFactory);
        Duration timeout = config.timeout();
        try {
            long rejected = switch (signal) {
                case METRIC -> {
                    ExportMetricsServiceResponse response = MetricsServiceGrpc.newBlockingStub(channel)
                            .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers))
                            .withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS)
                            .export(OtlpEncoder.encodeMetrics(records));
                    yield response.getPartialSuccess().getRejectedDataPoints();
                }
                case LOG -> {
                    ExportLogsServiceResponse response = LogsServiceGrpc.newBlockingStub(channel)
                            .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers))
                            .withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS)
                            .export(OtlpEncoder.encodeLogs(records));
                    yield response.getPartialSuccess().getRejectedLogRecords();
                }
                case SPAN -> {
                    ExportTraceServiceResponse response = TraceServiceGrpc.newBlockingStub(channel)
                            .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers))
                            .withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS)
                            .export(OtlpEncoder.encodeSpans(records));
                    yield response.getPartialSuccess().getRejectedSpans();
                }
            };
            if (rejected > 0) {
                logger.warn("Backend {} rejected {} of {} {} record(s) sent by '{}'", endpoint, rejected, records.size(),
                        signal.pipelineName(), name);
            }
            return ExportResult.success();
        } catch (StatusRuntimeException e) {
            Status status = e.getStatus();
            String message = endpoint + " returned " + status.getCode()
                    + (status.getDescription() == null ? "" : ": " + status.getDescription());
            return RETRYABLE_CODES.contains(status.getCode()) ? ExportResult.retryable(message) : ExportResult.permanent(message);
        }
    }

    @Override
    public void shutdown() {
        for (Map.Entry<String, ManagedChannel> entry : channels.entrySet()) {
            ManagedChannel channel = entry.getValue();
            channel.shutdown();
            try {
                if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                    channel.shutdownNow();
                }
            } catch (InterruptedException e) {
                channel.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.debug("Closed channel to {} of exporter '{}'", entry.getKey(), name);
        }
        channels.clear();
    }

    /**
     * Accepts {@code host:port} as well as {@code http://host:port} (plaintext) and {@code https://host:port}.
     */
    static ManagedChannel newChannel(String endpoint) {
        boolean tls = endpoint.startsWith("https://");
        String authority = endpoint.replaceFirst("^https?://", "");
        int slash = authority.indexOf('/');
        if (slash >= 0) {
            authority = authority.substring(0, slash);
        }
        HostAndPort hostAndPort = HostAndPort.fromString(authority).withDefaultPort(tls ? 443 : 4317);
        NettyChannelBuilder builder = NettyChannelBuilder.forAddress(hostAndPort.getHost(), hostAndPort.getPort());
        if (tls) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        return builder.build();
    }
}
