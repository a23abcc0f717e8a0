package com.example.opentelemetry.pipeline.model;

import io.opentelemetry.proto.common.v1.InstrumentationScope;

public record InstrumentationScopeInfo(InstrumentationScope scope, String schemaUrl) {

    public static final InstrumentationScopeInfo EMPTY =
            new InstrumentationScopeInfo(InstrumentationScope.getDefaultInstance(), "");

    public static InstrumentationScopeInfo of(String name, String version) {
        return new InstrumentationScopeInfo(InstrumentationScope.newBuilder().setName(name).setVersion(version).build(), "");
    }
}
