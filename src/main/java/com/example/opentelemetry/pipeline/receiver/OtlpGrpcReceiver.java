package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.google.common.net.HostAndPort;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class OtlpGrpcReceiver {
    static final String TRANSPORT = "grpc";

    final Logger logger = LoggerFactory.getLogger(getClass());

    private final ServerBuilder<?> serverBuilder;
    private Server server;

    public OtlpGrpcReceiver(PipelineConfig.GrpcReceiverConfig config, TelemetryIngest ingest) {
        this(NettyServerBuilder.forAddress(toSocketAddress(config.endpoint())), config, ingest);
    }

    public OtlpGrpcReceiver(ServerBuilder<?> serverBuilder, PipelineConfig.GrpcReceiverConfig config, TelemetryIngest ingest) {
        this.serverBuilder = serverBuilder
                .maxInboundMessageSize(Math.toIntExact(config.maxInboundMessageSizeMiB() * 1024L * 1024L))
                .addService(new TracesHandler(ingest))
                .addService(new LogsHandler(ingest))
                .addService(new MetricsHandler(ingest));
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Receiver is already running.");
        }
        this.server = serverBuilder.build();
        server.start();
        logger.info("OTLP gRPC receiver started on port: " + server.getPort());
    }

    public synchronized int port() {
        return server == null ? -1 : server.getPort();
    }

    public synchronized void stop(Duration timeout) throws InterruptedException {
        if (server == null) {
            return;
        }
        if (!server.shutdown().awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            logger.warn("OTLP gRPC receiver did not stop within {}, cancelling calls in flight", timeout);
            server.shutdownNow();
        }
        logger.info("OTLP gRPC receiver stopped");
        server = null;
    }

    static InetSocketAddress toSocketAddress(String endpoint) {
        HostAndPort hostAndPort = HostAndPort.fromString(endpoint);
        return new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort());
    }
}
