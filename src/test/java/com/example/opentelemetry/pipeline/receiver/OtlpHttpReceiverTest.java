package com.example.opentelemetry.pipeline.receiver;

import com.example.opentelemetry.pipeline.CollectorContext;
import com.example.opentelemetry.pipeline.TestTelemetry;
import com.example.opentelemetry.pipeline.model.SpanRecord;
import com.example.opentelemetry.pipeline.model.TelemetryRecord;
import com.example.opentelemetry.pipeline.processor.IngressQueue;
import com.google.common.io.BaseEncoding;
import io.grpc.Status;
import org.apache.http.HttpResponse;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

public class OtlpHttpReceiverTest {

    private static final String CONFIG = """
            receivers:
              otlp:
                http:
                  endpoint: 127.0.0.1:0
                  maxRequestBodySizeMiB: 1
            processors:
              queue:
                enqueueTimeout: 0s
            exporters:
              sink:
                type: logging
            service:
              pipelines:
                metrics:
                  exporters: [sink]
                traces:
                  exporters: [sink]
            extensions:
              healthCheck:
                enabled: false
            """;

    private static final ContentType PROTOBUF = ContentType.create("application/x-protobuf");

    private final IngressQueue queue = new IngressQueue(1);
    private final CloseableHttpClient client = HttpClients.createDefault();
    private OtlpHttpReceiver receiver;
    private String baseUrl;

    private record Reply(int status, String contentType, byte[] body, HttpResponse response) {
    }

    @BeforeEach
    public void setUp() throws Exception {
        CollectorContext context = TestTelemetry.context(CONFIG);
        receiver = new OtlpHttpReceiver(context.config().receivers().otlp().http(), new TelemetryIngest(context, queue));
        receiver.start();
        baseUrl = "http://127.0.0.1:" + receiver.port();
    }

    @AfterEach
    public void tearDown() throws Exception {
        client.close();
        receiver.stop(Duration.ofSeconds(1));
    }

    private Reply post(String path, byte[] body, ContentType contentType, String contentEncoding) throws IOException {
        HttpPost post = new HttpPost(baseUrl + path);
        post.setEntity(new ByteArrayEntity(body, contentType));
        if (contentEncoding != null) {
            post.setHeader("Content-Encoding", contentEncoding);
        }
        try (CloseableHttpResponse response = client.execute(post)) {
            return new Reply(response.getStatusLine().getStatusCode(),
                    response.getEntity().getContentType() == null ? null : response.getEntity().getContentType().getValue(),
                    EntityUtils.toByteArray(response.getEntity()), response);
        }
    }

    private Reply post(String path, byte[] body, ContentType contentType) throws IOException {
        return post(path, body, contentType, null);
    }

    private static byte[] gzip(byte[] body) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(body);
        }
        return out.toByteArray();
    }

    private static int statusCode(Reply reply) throws IOException {
        return com.google.rpc.Status.parseFrom(reply.body()).getCode();
    }

    @Test
    public void testAcceptsProtobufMetrics() throws Exception {
        Reply reply = post("/v1/metrics", OtlpRequests.gauge("queue.depth", 4, 2).toByteArray(), PROTOBUF);

        assertThat(reply.status()).isEqualTo(200);
        assertThat(reply.contentType()).startsWith("application/x-protobuf");
        assertThat(queue.poll(Duration.ofSeconds(1))).hasSize(2);
    }

    @Test
    public void testAcceptsGzipBody() throws Exception {
        Reply reply = post("/v1/metrics", gzip(OtlpRequests.gauge("queue.depth", 4).toByteArray()), PROTOBUF, "gzip");

        assertThat(reply.status()).isEqualTo(200);
        assertThat(queue.poll(Duration.ofSeconds(1))).hasSize(1);
    }

    @Test
    public void testAcceptsJsonWithHexIdentifiers() throws Exception {
        String json = """
                {"resourceSpans":[{"scopeSpans":[{"spans":[{
                  "traceId":"5b8efff798038103d269b633813fc60c",
                  "spanId":"eee19b7ec3c1b174",
                  "name":"GET /",
                  "startTimeUnixNano":"1700000000000000000",
                  "endTimeUnixNano":"1700000000100000000"}]}]}]}
                """;

        Reply reply = post("/v1/traces", json.getBytes(StandardCharsets.UTF_8), ContentType.APPLICATION_JSON);

        assertThat(reply.status()).isEqualTo(200);
        assertThat(reply.contentType()).startsWith("application/json");
        assertThat(new String(reply.body(), StandardCharsets.UTF_8)).isEqualTo("{}");
        List<TelemetryRecord> records = queue.poll(Duration.ofSeconds(1));
        assertThat(records).hasSize(1);
        SpanRecord span = (SpanRecord) records.get(0);
        assertThat(BaseEncoding.base16().lowerCase().encode(span.payload().getTraceId().toByteArray()))
                .isEqualTo("5b8efff798038103d269b633813fc60c");
    }

    @Test
    public void testRejectsMalformedProtobuf() throws Exception {
        Reply reply = post("/v1/metrics", "not a protobuf".getBytes(StandardCharsets.UTF_8), PROTOBUF);

        assertThat(reply.status()).isEqualTo(400);
        assertThat(statusCode(reply)).isEqualTo(Status.Code.INVALID_ARGUMENT.value());
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    public void testRejectsMalformedJsonWithJsonStatus() throws Exception {
        Reply reply = post("/v1/metrics", "{\"resourceMetrics\": [".getBytes(StandardCharsets.UTF_8), ContentType.APPLICATION_JSON);

        assertThat(reply.status()).isEqualTo(400);
        assertThat(reply.contentType()).startsWith("application/json");
        assertThat(new String(reply.body(), StandardCharsets.UTF_8)).contains("\"code\":3");
    }

    @Test
    public void testRejectsSpanWithInvalidIdentifiers() throws Exception {
        byte[] body = OtlpRequests.spans(TestTelemetry.randomId(16), TestTelemetry.randomId(4)).toByteArray();

        Reply reply = post("/v1/traces", body, PROTOBUF);

        assertThat(reply.status()).isEqualTo(400);
    }

    @Test
    public void testUnknownPathAndDisabledSignalAreNotFound() throws Exception {
        assertThat(post("/v1/profiles", new byte[0], PROTOBUF).status()).isEqualTo(404);
        assertThat(post("/v1/logs", OtlpRequests.logs("hi").toByteArray(), PROTOBUF).status()).isEqualTo(404);
    }

    @Test
    public void testOnlyPostIsAllowed() throws Exception {
        try (CloseableHttpResponse response = client.execute(new HttpGet(baseUrl + "/v1/metrics"))) {
            assertThat(response.getStatusLine().getStatusCode()).isEqualTo(405);
            assertThat(response.getFirstHeader("Allow").getValue()).isEqualTo("POST");
        }
    }

    @Test
    public void testUnsupportedContentType() throws Exception {
        Reply reply = post("/v1/metrics", "cpu 0.5".getBytes(StandardCharsets.UTF_8), ContentType.TEXT_PLAIN);

        assertThat(reply.status()).isEqualTo(415);
    }

    @Test
    public void testUnsupportedContentEncoding() throws Exception {
        Reply reply = post("/v1/metrics", OtlpRequests.gauge("queue.depth", 1).toByteArray(), PROTOBUF, "br");

        assertThat(reply.status()).isEqualTo(400);
    }

    @Test
    public void testRejectsEmptyGzipBody() throws Exception {
        Reply reply = post("/v1/metrics", new byte[0], PROTOBUF, "gzip");

        assertThat(reply.status()).isEqualTo(400);
        assertThat(statusCode(reply)).isEqualTo(Status.Code.INVALID_ARGUMENT.value());
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    public void testRejectsTruncatedGzipBody() throws Exception {
        byte[] compressed = gzip(OtlpRequests.gauge("queue.depth", 4, 2).toByteArray());

        Reply reply = post("/v1/metrics", Arrays.copyOf(compressed, compressed.length - 12), PROTOBUF, "gzip");

        assertThat(reply.status()).isEqualTo(400);
        assertThat(statusCode(reply)).isEqualTo(Status.Code.INVALID_ARGUMENT.value());
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    public void testDecompressedBodyOverLimitIsRefused() throws Exception {
        byte[] large = new byte[1024 * 1024 + 1];

        Reply reply = post("/v1/metrics", gzip(large), PROTOBUF, "gzip");

        assertThat(reply.status()).isEqualTo(413);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    public void testFullQueueAnswersServiceUnavailableWithRetryAfter() throws Exception {
        assertThat(post("/v1/metrics", OtlpRequests.gauge("a", 1).toByteArray(), PROTOBUF).status()).isEqualTo(200);

        Reply reply = post("/v1/metrics", OtlpRequests.gauge("b", 1).toByteArray(), PROTOBUF);

        assertThat(reply.status()).isEqualTo(503);
        assertThat(reply.response().getFirstHeader("Retry-After").getValue()).isEqualTo("1");
        assertThat(statusCode(reply)).isEqualTo(Status.Code.UNAVAILABLE.value());
    }

    @Test
    public void testMediaTypeIgnoresParameters() {
        assertThat(OtlpHttpHandler.mediaType("Application/JSON; charset=utf-8")).isEqualTo("application/json");
        assertThat(OtlpHttpHandler.mediaType(null)).isEmpty();
    }
}
