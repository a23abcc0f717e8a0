package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.google.common.net.HostAndPort;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public final class OtlpHttpReceiver {
    final Logger logger = LoggerFactory.getLogger(getClass());

    private final HostAndPort endpoint;
    private final OtlpHttpHandler handler;
    private Server server;
    private ServerConnector connector;

    public OtlpHttpReceiver(PipelineConfig.HttpReceiverConfig config, TelemetryIngest ingest) {
        this.endpoint = HostAndPort.fromString(config.endpoint());
        this.handler = new OtlpHttpHandler(ingest, config.maxRequestBodySizeMiB() * 1024L * 1024L);
    }

    public synchronized void start() throws Exception {
        if (server != null) {
            throw new IllegalStateException("Receiver is already running.");
        }
        logger.info("Binding OTLP HTTP receiver to " + endpoint);
        this.server = new Server();
        this.connector = new ServerConnector(server);
        connector.setHost(endpoint.getHost());
        connector.setPort(endpoint.getPort());
        server.addConnector(connector);
        server.setHandler(handler);
        server.setStopTimeout(0);
        server.start();
        logger.info("OTLP HTTP receiver started on port: " + connector.getLocalPort());
    }

    public synchronized int port() {
        return connector == null ? -1 : connector.getLocalPort();
    }

    public synchronized void stop(Duration timeout) throws Exception {
        if (server == null) {
            return;
        }
        server.setStopTimeout(timeout.toMillis());
        server.stop();
        server.join();
        server = null;
        connector = null;
        logger.info("OTLP HTTP receiver stopped");
    }
}
