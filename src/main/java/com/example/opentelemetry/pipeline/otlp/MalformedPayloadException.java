package com.example.opentelemetry.pipeline.otlp;

/**
 * The request payload cannot be decoded into telemetry records. This is a client error: the request must be
 * rejected as a whole and never retried by the collector.
 */
public class MalformedPayloadException extends Exception {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
