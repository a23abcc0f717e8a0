package com.example.opentelemetry.pipeline.resource;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResourceAttributesParserTest {

    @Test
    public void testParsesPairsInOrder() {
        Map<String, String> attributes = ResourceAttributesParser.parse(" service.name = checkout ,deployment.environment=prod,,");

        assertThat(attributes).containsExactly(
                Map.entry("service.name", "checkout"),
                Map.entry("deployment.environment", "prod"));
    }

    @Test
    public void testDecodesPercentEncodedValues() {
        Map<String, String> attributes = ResourceAttributesParser.parse("team=payments%2Fcore,label=a%20b,expr=1+1");

        assertThat(attributes)
                .containsEntry("team", "payments/core")
                .containsEntry("label", "a b")
                .containsEntry("expr", "1+1");
    }

    @Test
    public void testValueMayContainEquals() {
        assertThat(ResourceAttributesParser.parse("query=a=b")).containsEntry("query", "a=b");
    }

    @Test
    public void testBlankInputIsEmpty() {
        assertThat(ResourceAttributesParser.parse(null)).isEmpty();
        assertThat(ResourceAttributesParser.parse("  ")).isEmpty();
    }

    @Test
    public void testRejectsMalformedEntries() {
        assertThatThrownBy(() -> ResourceAttributesParser.parse("service.name=a,oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected key=value");
        assertThatThrownBy(() -> ResourceAttributesParser.parse("=value"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty key");
    }
}
