package com.autoria.tracker.scrape.model;

import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String userAgent,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static final int TOO_MANY_REQUESTS = 429;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isRateLimited() {
        return statusCode == TOO_MANY_REQUESTS;
    }
}
