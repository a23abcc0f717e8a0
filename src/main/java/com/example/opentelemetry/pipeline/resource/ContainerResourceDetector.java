package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code container.id} from {@code /proc/self/cgroup} (cgroup v1) or {@code /proc/self/mountinfo}
 * (cgroup v2). Contributes nothing outside a container.
 */
class ContainerResourceDetector implements ResourceDetector {

    private static final Pattern CGROUP_CONTAINER_ID = Pattern.compile("([0-9a-f]{64})(?:\\.scope)?$");
    private static final Pattern MOUNTINFO_CONTAINER_ID = Pattern.compile("/(?:docker/)?containers/([0-9a-f]{64})/");

    private final Path cgroupFile;
    private final Path mountInfoFile;

    ContainerResourceDetector() {
        this(Paths.get("/proc/self/cgroup"), Paths.get("/proc/self/mountinfo"));
    }

    ContainerResourceDetector(Path cgroupFile, Path mountInfoFile) {
        this.cgroupFile = cgroupFile;
        this.mountInfoFile = mountInfoFile;
    }

    @Override
    public String name() {
        return "container";
    }

    @Override
    public TelemetryResource detect() throws IOException {
        String containerId = fromCgroup();
        if (containerId == null) {
            containerId = fromMountInfo();
        }
        return containerId == null
                ? TelemetryResource.EMPTY
                : TelemetryResource.builder().put(ResourceAttributes.CONTAINER_ID, containerId).build();
    }

    @Nullable
    private String fromCgroup() throws IOException {
        for (String line : readLines(cgroupFile)) {
            int lastSlash = line.lastIndexOf('/');
            Matcher matcher = CGROUP_CONTAINER_ID.matcher(line.substring(lastSlash + 1).trim());
            if (lastSlash >= 0 && matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    @Nullable
    private String fromMountInfo() throws IOException {
        for (String line : readLines(mountInfoFile)) {
            Matcher matcher = MOUNTINFO_CONTAINER_ID.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private static List<String> readLines(Path file) throws IOException {
        return Files.isReadable(file) ? Files.readAllLines(file, StandardCharsets.UTF_8) : List.of();
    }
}
