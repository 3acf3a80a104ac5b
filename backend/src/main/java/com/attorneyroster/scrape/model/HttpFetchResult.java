package com.attorneyroster.scrape.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public HttpFetchResult withAttempts(int attemptCount) {
        return new HttpFetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            contentType,
            fetchedAt,
            duration,
            attemptCount,
            errorCode,
            errorMessage
        );
    }

    public String failureSummary() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : " (" + errorMessage + ")");
        }
        return "http_status_" + statusCode;
    }
}
