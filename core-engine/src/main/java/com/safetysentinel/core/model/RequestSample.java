package com.safetysentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One served request, as reported by the HTTP layer.
 *
 * @since 1.0.0
 */
public final class RequestSample {

    private final String endpoint;
    private final double durationSeconds;
    private final int statusCode;
    private final Instant timestamp;

    public RequestSample(String endpoint, double durationSeconds, int statusCode, Instant timestamp) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.durationSeconds = durationSeconds;
        this.statusCode = statusCode;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getEndpoint() {
        return endpoint;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return {@code true} for 4xx and 5xx responses
     */
    public boolean isError() {
        return statusCode >= 400;
    }

    @Override
    public String toString() {
        return "RequestSample{" +
                "endpoint='" + endpoint + '\'' +
                ", durationSeconds=" + durationSeconds +
                ", statusCode=" + statusCode +
                '}';
    }
}
