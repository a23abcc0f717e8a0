package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.TelemetryResource;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Reads the EC2 instance identity document through the instance metadata service, IMDSv2 first with a fallback
 * to IMDSv1. Off EC2 the endpoint is unreachable and the detector contributes nothing.
 */
class Ec2ResourceDetector implements ResourceDetector {
    final Logger logger = LoggerFactory.getLogger(getClass());
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static final String DEFAULT_ENDPOINT = "http://169.254.169.254";
    static final String TOKEN_HEADER = "X-aws-ec2-metadata-token";
    static final String TOKEN_TTL_HEADER = "X-aws-ec2-metadata-token-ttl-seconds";

    private final String endpoint;
    private final Duration timeout;

    Ec2ResourceDetector(Duration timeout) {
        this(DEFAULT_ENDPOINT, timeout);
    }

    Ec2ResourceDetector(String endpoint, Duration timeout) {
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "ec2";
    }

    @Override
    public TelemetryResource detect() throws IOException {
        int timeoutMillis = (int) timeout.toMillis();
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();
        try (CloseableHttpClient client = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build()) {
            String token = fetchToken(client);

            HttpGet documentRequest = new HttpGet(endpoint + "/latest/dynamic/instance-identity/document");
            String document = fetch(client, documentRequest, token);
            if (document == null) {
                return TelemetryResource.EMPTY;
            }
            IdentityDocument identity = OBJECT_MAPPER.readValue(document, IdentityDocument.class);

            TelemetryResource.Builder builder = TelemetryResource.builder()
                    .put(ResourceAttributes.CLOUD_PROVIDER, ResourceAttributes.CloudProviderValues.AWS)
                    .put(ResourceAttributes.CLOUD_PLATFORM, ResourceAttributes.CloudPlatformValues.AWS_EC2);
            putIfSet(builder, ResourceAttributes.CLOUD_ACCOUNT_ID.getKey(), identity.accountId);
            putIfSet(builder, ResourceAttributes.CLOUD_REGION.getKey(), identity.region);
            putIfSet(builder, ResourceAttributes.CLOUD_AVAILABILITY_ZONE.getKey(), identity.availabilityZone);
            putIfSet(builder, ResourceAttributes.HOST_ID.getKey(), identity.instanceId);
            putIfSet(builder, ResourceAttributes.HOST_TYPE.getKey(), identity.instanceType);
            putIfSet(builder, ResourceAttributes.HOST_IMAGE_ID.getKey(), identity.imageId);
            putIfSet(builder, ResourceAttributes.HOST_NAME.getKey(),
                    fetch(client, new HttpGet(endpoint + "/latest/meta-data/hostname"), token));
            return builder.build();
        }
    }

    @Nullable
    private String fetchToken(CloseableHttpClient client) {
        HttpPut tokenRequest = new HttpPut(endpoint + "/latest/api/token");
        tokenRequest.setHeader(TOKEN_TTL_HEADER, "60");
        try {
            return fetch(client, tokenRequest, null);
        } catch (IOException e) {
            logger.debug("IMDSv2 token not available, trying IMDSv1: {}", e.toString());
            return null;
        }
    }

    @Nullable
    private static String fetch(CloseableHttpClient client, HttpUriRequest request, @Nullable String token) throws IOException {
        if (token != null) {
            request.setHeader(TOKEN_HEADER, token);
        }
        try (CloseableHttpResponse response = client.execute(request)) {
            if (response.getStatusLine().getStatusCode() != 200 || response.getEntity() == null) {
                return null;
            }
            return EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        }
    }

    private static void putIfSet(TelemetryResource.Builder builder, String key, @Nullable String value) {
        if (value != null && !value.isBlank()) {
            builder.put(key, value.trim());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class IdentityDocument {
        public String accountId;
        public String region;
        public String availabilityZone;
        public String instanceId;
        public String instanceType;
        public String imageId;
    }
}
