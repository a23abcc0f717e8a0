package com.example.opentelemetry.pipeline.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the YAML collector configuration, expands {@code ${env:NAME}} and {@code ${env:NAME:-default}}
 * references and validates the result.
 */
public class ConfigLoader {
    final Logger logger = LoggerFactory.getLogger(getClass());

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{env:([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    public ConfigLoader(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment);
        SimpleModule durations = new SimpleModule("durations");
        durations.addDeserializer(Duration.class, new DurationDeserializer());
        this.mapper = new ObjectMapper(new YAMLFactory())
                .registerModule(durations)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public PipelineConfig load(Path path) {
        String yaml;
        try {
            yaml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
        logger.info("Loading configuration from {}", path);
        return parse(yaml);
    }

    public PipelineConfig parse(String yaml) {
        PipelineConfig config;
        try {
            config = mapper.readValue(expandEnvironment(yaml), PipelineConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage()
                    + locationOf(e), e);
        }
        if (config == null) {
            throw new ConfigurationException("Invalid configuration: the document is empty");
        }
        new ConfigValidator().validate(config);
        return config;
    }

    String expandEnvironment(String yaml) {
        StringBuilder expanded = new StringBuilder();
        String[] lines = yaml.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                expanded.append('\n');
            }
            String line = lines[i];
            int comment = commentStart(line);
            expandReferences(line.substring(0, comment), expanded);
            expanded.append(line, comment, line.length());
        }
        return expanded.toString();
    }

    private void expandReferences(String text, StringBuilder expanded) {
        Matcher matcher = ENV_REFERENCE.matcher(text);
        while (matcher.find()) {
            String value = environment.get(matcher.group(1));
            if (value == null) {
                value = matcher.group(2);
            }
            if (value == null) {
                throw new ConfigurationException("Environment variable " + matcher.group(1)
                        + " referenced by the configuration is not set");
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(expanded);
    }

    /**
     * Index of the {@code #} opening a YAML comment on this line, or the line length when there is none. A
     * {@code #} inside a quoted scalar or glued to the preceding text does not start a comment.
     */
    static int commentStart(String line) {
        boolean singleQuoted = false;
        boolean doubleQuoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (doubleQuoted && c == '\\') {
                i++;
            } else if (c == '"' && !singleQuoted && (doubleQuoted || opensScalar(line, i))) {
                doubleQuoted = !doubleQuoted;
            } else if (c == '\'' && !doubleQuoted && (singleQuoted || opensScalar(line, i))) {
                singleQuoted = !singleQuoted;
            } else if (c == '#' && !singleQuoted && !doubleQuoted && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                return i;
            }
        }
        return line.length();
    }

    private static boolean opensScalar(String line, int quote) {
        return quote == 0 || Character.isWhitespace(line.charAt(quote - 1)) || "[{,:-".indexOf(line.charAt(quote - 1)) >= 0;
    }

    private static String locationOf(JsonProcessingException e) {
        if (e.getLocation() == null) {
            return "";
        }
        return " (line " + e.getLocation().getLineNr() + ", column " + e.getLocation().getColumnNr() + ")";
    }
}
