package com.autoria.tracker.scrape.model;

public enum ScrapePhase {
    DISCOVER,
    FILTER,
    FETCH_EXTRACT,
    AGGREGATE,
    PERSIST
}
