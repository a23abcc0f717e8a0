package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.config.ConfigurationException;
import com.example.opentelemetry.pipeline.config.PipelineConfig.ResourceDetectionConfig;
import com.example.opentelemetry.pipeline.model.TelemetryResource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResourceResolverTest {

    @Test
    public void testEarlierDetectorWins() throws Exception {
        ResourceResolver resolver = new ResourceResolver(List.of(
                detector("first", () -> TelemetryResource.builder().put("service.name", "checkout").build()),
                detector("second", () -> TelemetryResource.builder()
                        .put("service.name", "ignored")
                        .put("host.name", "node-1")
                        .build())),
                Duration.ofSeconds(2));

        TelemetryResource resource = resolver.resolve();

        assertThat(resource.getString("service.name")).isEqualTo("checkout");
        assertThat(resource.getString("host.name")).isEqualTo("node-1");
    }

    @Test
    public void testFailingDetectorIsSkipped() throws Exception {
        ResourceResolver resolver = new ResourceResolver(List.of(
                detector("broken", () -> {
                    throw new IllegalStateException("metadata service exploded");
                }),
                detector("ok", () -> TelemetryResource.builder().put("os.type", "linux").build())),
                Duration.ofSeconds(2));

        assertThat(resolver.resolve().attributes()).containsOnlyKeys("os.type");
    }

    @Test
    public void testSlowDetectorMissesDeadline() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        ResourceResolver resolver = new ResourceResolver(List.of(
                detector("slow", () -> {
                    never.await(30, TimeUnit.SECONDS);
                    return TelemetryResource.builder().put("cloud.region", "eu-west-1").build();
                }),
                detector("fast", () -> TelemetryResource.builder().put("host.name", "node-1").build())),
                Duration.ofMillis(200));

        long start = System.nanoTime();
        TelemetryResource resource = resolver.resolve();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(resource.attributes()).containsOnlyKeys("host.name");
        assertThat(elapsedMillis).isLessThan(2000);
    }

    @Test
    public void testNoCloudMetadataAvailable() throws Exception {
        ResourceResolver resolver = new ResourceResolver(List.of(
                new HostResourceDetector(Map.of("HOSTNAME", "node-1")),
                new OsResourceDetector(),
                new Ec2ResourceDetector("http://10.255.255.1", Duration.ofSeconds(2))),
                Duration.ofSeconds(2));

        long start = System.nanoTime();
        TelemetryResource resource = resolver.resolve();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMillis).isLessThan(3000);
        assertThat(resource.attributes()).containsKeys("host.name", "os.type");
        assertThat(resource.attributes()).doesNotContainKeys("cloud.provider", "cloud.region");
    }

    @Test
    public void testNoDetectors() throws Exception {
        assertThat(new ResourceResolver(List.of(), Duration.ofSeconds(1)).resolve().isEmpty()).isTrue();
    }

    @Test
    public void testFromConfig() throws Exception {
        ResourceResolver resolver = ResourceResolver.fromConfig(
                new ResourceDetectionConfig(List.of("env", "os"), Duration.ofSeconds(2)),
                Map.of("OTEL_SERVICE_NAME", "checkout"));

        TelemetryResource resource = resolver.resolve();

        assertThat(resource.getString("service.name")).isEqualTo("checkout");
        assertThat(resource.getString("os.type")).isNotBlank();
        assertThat(resource.attributes()).doesNotContainKey("host.name");
    }

    @Test
    public void testFromConfigRejectsUnknownDetector() {
        assertThatThrownBy(() -> ResourceResolver.fromConfig(
                new ResourceDetectionConfig(List.of("gcp"), null), Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("gcp");
    }

    private static ResourceDetector detector(String name, Callable<TelemetryResource> detect) {
        return new ResourceDetector() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public TelemetryResource detect() throws Exception {
                return detect.call();
            }
        };
    }
}
