package com.example.opentelemetry.pipeline.model;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one delivery attempt of records to one exporter.
 *
 * @param retryAfter delay requested by the backend before the next attempt, if it sent one
 */
public record ExportResult(Status status, String message, @Nullable Duration retryAfter) {

    public enum Status {
        SUCCESS,
        RETRYABLE_FAILURE,
        PERMANENT_FAILURE
    }

    private static final ExportResult SUCCESS = new ExportResult(Status.SUCCESS, "", null);

    public ExportResult {
        Objects.requireNonNull(status, "status");
        message = message == null ? "" : message;
    }

    public static ExportResult success() {
        return SUCCESS;
    }

    public static ExportResult retryable(String message) {
        return new ExportResult(Status.RETRYABLE_FAILURE, message, null);
    }

    public static ExportResult retryable(String message, @Nullable Duration retryAfter) {
        return new ExportResult(Status.RETRYABLE_FAILURE, message, retryAfter);
    }

    public static ExportResult permanent(String message) {
        return new ExportResult(Status.PERMANENT_FAILURE, message, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE_FAILURE;
    }
}
