package com.autoria.tracker.scrape.model;

public record ScrapeStatusResponse(
    boolean running,
    ScrapeRunSummary lastRun
) {
}
