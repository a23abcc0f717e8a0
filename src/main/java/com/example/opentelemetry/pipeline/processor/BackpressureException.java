package com.example.opentelemetry.pipeline.processor;

/**
 * The pipeline cannot accept more records right now. Callers should retry later; nothing was enqueued.
 */
public class BackpressureException extends Exception {

    public BackpressureException(String message) {
        super(message);
    }
}
