package com.example.opentelemetry.pipeline.resource;

import com.example.opentelemetry.pipeline.model.TelemetryResource;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;

import java.util.Locale;

class OsResourceDetector implements ResourceDetector {

    @Override
    public String name() {
        return "os";
    }

    @Override
    public TelemetryResource detect() {
        String osName = System.getProperty("os.name");
        if (osName == null) {
            return TelemetryResource.EMPTY;
        }
        String osVersion = System.getProperty("os.version");
        return TelemetryResource.builder()
                .put(ResourceAttributes.OS_TYPE, osType(osName))
                .put(ResourceAttributes.OS_DESCRIPTION, osVersion == null ? osName : osName + " " + osVersion)
                .build();
    }

    static String osType(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) {
            return ResourceAttributes.OsTypeValues.WINDOWS;
        } else if (name.startsWith("linux")) {
            return ResourceAttributes.OsTypeValues.LINUX;
        } else if (name.startsWith("mac")) {
            return ResourceAttributes.OsTypeValues.DARWIN;
        } else if (name.startsWith("freebsd")) {
            return ResourceAttributes.OsTypeValues.FREEBSD;
        } else if (name.startsWith("netbsd")) {
            return ResourceAttributes.OsTypeValues.NETBSD;
        } else if (name.startsWith("openbsd")) {
            return ResourceAttributes.OsTypeValues.OPENBSD;
        } else if (name.startsWith("sunos") || name.startsWith("solaris")) {
            return ResourceAttributes.OsTypeValues.SOLARIS;
        } else if (name.startsWith("aix")) {
            return ResourceAttributes.OsTypeValues.AIX;
        }
        return name;
    }
}
