package com.autoria.tracker.scrape.model;

import java.time.Instant;
import java.util.Map;

public record ScrapeRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int pagesRequested,
    int pagesFetched,
    int linksDiscovered,
    int newLinks,
    int extracted,
    Map<String, Integer> skippedByReason,
    Map<String, Integer> failedByReason,
    Map<String, Integer> writtenBySink,
    String errorMessage
) {
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";
}
