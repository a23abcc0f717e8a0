package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.TelemetryResource;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Ec2ResourceDetectorTest {

    private static final String TOKEN = "AQAEAJx4l5U";
    private static final String IDENTITY_DOCUMENT = """
            {
              "accountId" : "123456789012",
              "architecture" : "x86_64",
              "availabilityZone" : "eu-west-1b",
              "imageId" : "ami-0abcdef1234567890",
              "instanceId" : "i-0123456789abcdef0",
              "instanceType" : "m5.large",
              "region" : "eu-west-1"
            }""";

    private volatile boolean tokenSupported = true;
    private Server server;
    private String endpoint;

    @BeforeEach
    public void setUp() throws Exception {
        server = new Server(new InetSocketAddress("127.0.0.1", 0));
        server.setHandler(new AbstractHandler() {
            @Override
            public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response)
                    throws IOException {
                baseRequest.setHandled(true);
                if (target.equals("/latest/api/token")) {
                    if (!tokenSupported || !"PUT".equals(request.getMethod())
                            || request.getHeader(Ec2ResourceDetector.TOKEN_TTL_HEADER) == null) {
                        response.setStatus(404);
                        return;
                    }
                    write(response, TOKEN);
                    return;
                }
                if (tokenSupported && !TOKEN.equals(request.getHeader(Ec2ResourceDetector.TOKEN_HEADER))) {
                    response.setStatus(401);
                    return;
                }
                switch (target) {
                    case "/latest/dynamic/instance-identity/document" -> write(response, IDENTITY_DOCUMENT);
                    case "/latest/meta-data/hostname" -> write(response, "ip-10-0-0-12.eu-west-1.compute.internal\n");
                    default -> response.setStatus(404);
                }
            }
        });
        server.start();
        endpoint = "http://127.0.0.1:" + ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    }

    @AfterEach
    public void tearDown() throws Exception {
        server.stop();
    }

    private static void write(HttpServletResponse response, String body) throws IOException {
        response.setStatus(200);
        response.setContentType("text/plain");
        response.getOutputStream().write(body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testReadsIdentityDocumentWithToken() throws Exception {
        TelemetryResource resource = new Ec2ResourceDetector(endpoint, Duration.ofSeconds(2)).detect();

        assertThat(resource.getString("cloud.provider")).isEqualTo("aws");
        assertThat(resource.getString("cloud.platform")).isEqualTo("aws_ec2");
        assertThat(resource.getString("cloud.account.id")).isEqualTo("123456789012");
        assertThat(resource.getString("cloud.region")).isEqualTo("eu-west-1");
        assertThat(resource.getString("cloud.availability_zone")).isEqualTo("eu-west-1b");
        assertThat(resource.getString("host.id")).isEqualTo("i-0123456789abcdef0");
        assertThat(resource.getString("host.type")).isEqualTo("m5.large");
        assertThat(resource.getString("host.image.id")).isEqualTo("ami-0abcdef1234567890");
        assertThat(resource.getString("host.name")).isEqualTo("ip-10-0-0-12.eu-west-1.compute.internal");
    }

    @Test
    public void testFallsBackWithoutToken() throws Exception {
        tokenSupported = false;

        TelemetryResource resource = new Ec2ResourceDetector(endpoint, Duration.ofSeconds(2)).detect();

        assertThat(resource.getString("host.id")).isEqualTo("i-0123456789abcdef0");
    }

    @Test
    public void testUnreachableEndpointFails() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        Ec2ResourceDetector detector = new Ec2ResourceDetector("http://127.0.0.1:" + port, Duration.ofMillis(500));

        assertThatThrownBy(detector::detect).isInstanceOf(IOException.class);
    }
}
