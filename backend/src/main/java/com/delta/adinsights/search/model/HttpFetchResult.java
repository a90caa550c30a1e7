package com.delta.adinsights.search.model;

import java.time.Duration;

/**
 * Raw outcome of one provider HTTP exchange. Transport failures carry an {@code errorCode}
 * and a zero status instead of throwing.
 */
public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String contentType,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTransportFailure() {
        return errorCode != null;
    }
}
