package com.autoria.tracker.scrape.output;

import com.autoria.tracker.scrape.model.CarListing;

import java.util.List;

/**
 * Consumer of a finished scrape batch. Sinks must not rely on the order of {@code listings}.
 */
public interface ListingSink {

    String name();

    boolean isEnabled();

    /**
     * @return number of listings the sink stored
     */
    int write(List<CarListing> listings);
}
