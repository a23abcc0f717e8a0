package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Map;

class HostResourceDetector implements ResourceDetector {
    final Logger logger = LoggerFactory.getLogger(getClass());

    private final Map<String, String> env;

    HostResourceDetector(Map<String, String> env) {
        this.env = env;
    }

    @Override
    public String name() {
        return "host";
    }

    @Override
    public TelemetryResource detect() {
        TelemetryResource.Builder builder = TelemetryResource.builder();
        String hostName = hostName();
        if (hostName != null) {
            builder.put(ResourceAttributes.HOST_NAME, hostName);
        }
        String arch = System.getProperty("os.arch");
        if (arch != null) {
            builder.put(ResourceAttributes.HOST_ARCH, architecture(arch));
        }
        return builder.build();
    }

    private String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.debug("Cannot resolve the local host name, falling back to HOSTNAME", e);
            String hostName = env.get("HOSTNAME");
            return hostName == null || hostName.isBlank() ? null : hostName.trim();
        }
    }

    static String architecture(String osArch) {
        return switch (osArch.toLowerCase(Locale.ROOT)) {
            case "amd64", "x86_64" -> ResourceAttributes.HostArchValues.AMD64;
            case "aarch64", "arm64" -> ResourceAttributes.HostArchValues.ARM64;
            case "x86", "i386", "i686" -> ResourceAttributes.HostArchValues.X86;
            case "ppc64" -> ResourceAttributes.HostArchValues.PPC64;
            case "s390x" -> ResourceAttributes.HostArchValues.S390X;
            default -> osArch;
        };
    }
}
