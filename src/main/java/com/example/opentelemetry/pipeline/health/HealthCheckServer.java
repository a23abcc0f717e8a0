package com.example.opentelemetry.pipeline.health;

import com.example.opentelemetry.pipeline.config.PipelineConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.HostAndPort;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Liveness endpoint: {@code GET /} answers 200 once the collector is ready and 503 before that or once it
 * started shutting down.
 */
public final class HealthCheckServer {
    final Logger logger = LoggerFactory.getLogger(getClass());
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final HostAndPort endpoint;
    private final Clock clock;
    private volatile Instant upSince;
    private Server server;
    private ServerConnector connector;

    public HealthCheckServer(PipelineConfig.HealthCheckConfig config) {
        this(config, Clock.systemUTC());
    }

    HealthCheckServer(PipelineConfig.HealthCheckConfig config, Clock clock) {
        this.endpoint = HostAndPort.fromString(config.endpoint());
        this.clock = clock;
    }

    public synchronized void start() throws Exception {
        if (server != null) {
            throw new IllegalStateException("Server is already running.");
        }
        logger.info("Binding health check to " + endpoint);
        this.server = new Server();
        this.connector = new ServerConnector(server);
        connector.setHost(endpoint.getHost());
        connector.setPort(endpoint.getPort());
        server.addConnector(connector);
        server.setHandler(new StatusHandler());
        server.start();
    }

    public void ready() {
        upSince = clock.instant();
        logger.info("Everything is ready. Begin running and processing data.");
    }

    public void notReady() {
        upSince = null;
    }

    public synchronized int port() {
        return connector == null ? -1 : connector.getLocalPort();
    }

    public synchronized void stop() throws Exception {
        if (server == null) {
            return;
        }
        server.stop();
        server.join();
        server = null;
        connector = null;
    }

    HealthStatus status() {
        Instant since = upSince;
        if (since == null) {
            return new HealthStatus("Server not available", null, null);
        }
        return new HealthStatus("Server available", since.toString(), formatUptime(Duration.between(since, clock.instant())));
    }

    /**
     * Formats a duration the way Go prints one, e.g. {@code 1h2m3.5s}.
     */
    static String formatUptime(Duration uptime) {
        long hours = uptime.toHours();
        long minutes = uptime.toMinutesPart();
        double seconds = uptime.toSecondsPart() + uptime.toNanosPart() / 1e9;
        StringBuilder sb = new StringBuilder();
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (hours > 0 || minutes > 0) {
            sb.append(minutes).append('m');
        }
        String secondsText = seconds == Math.rint(seconds) ? Long.toString((long) seconds) : String.valueOf(seconds);
        return sb.append(secondsText).append('s').toString();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record HealthStatus(@JsonProperty("status") String status,
                        @Nullable @JsonProperty("upSince") String upSince,
                        @Nullable @JsonProperty("uptime") String uptime) {
        boolean available() {
            return upSince != null;
        }
    }

    private final class StatusHandler extends AbstractHandler {
        @Override
        public void handle(String target, Request baseRequest, HttpServletRequest request,
                           HttpServletResponse response) throws IOException {
            baseRequest.setHandled(true);
            if (!"/".equals(target)) {
                response.sendError(HttpServletResponse.SC_NOT_FOUND);
                return;
            }
            if (!HttpMethod.GET.is(request.getMethod())) {
                response.setHeader("Allow", "GET");
                response.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
                return;
            }
            HealthStatus status = status();
            response.setStatus(status.available() ? HttpServletResponse.SC_OK : HttpServletResponse.SC_SERVICE_UNAVAILABLE);
            response.setContentType("application/json");
            response.setCharacterEncoding("UTF-8");
            OBJECT_MAPPER.writeValue(response.getOutputStream(), status);
        }
    }
}
