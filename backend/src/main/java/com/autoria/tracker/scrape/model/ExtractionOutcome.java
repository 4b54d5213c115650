package com.autoria.tracker.scrape.model;

/**
 * Result of processing one candidate URL. Exactly one of {@code listing} (on success) or
 * {@code reason} (on skip or failure) is set.
 */
public record ExtractionOutcome(
    String url,
    Status status,
    CarListing listing,
    String reason
) {
    public static final String REASON_NEW_CAR = "new_car";
    public static final String REASON_ALREADY_STORED = "already_stored";
    public static final String REASON_FETCH_UNAVAILABLE = "fetch_unavailable";
    public static final String REASON_MISSING_TITLE = "missing_title";
    public static final String REASON_PARSE_ERROR = "parse_error";
    public static final String REASON_UNEXPECTED_ERROR = "unexpected_error";

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public static ExtractionOutcome success(CarListing listing) {
        return new ExtractionOutcome(listing.url(), Status.SUCCESS, listing, null);
    }

    public static ExtractionOutcome skipped(String url, String reason) {
        return new ExtractionOutcome(url, Status.SKIPPED, null, reason);
    }

    public static ExtractionOutcome failed(String url, String reason) {
        return new ExtractionOutcome(url, Status.FAILED, null, reason);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
