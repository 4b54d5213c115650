package com.autoria.tracker.scrape.persistence;

import com.autoria.tracker.scrape.model.CarListing;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * What the scrape pipeline needs from storage. Implementations must reject a second listing with
 * the same url.
 */
public interface CarListingStore {

    /**
     * Returns the subset of {@code urls} that is already stored, in a single lookup.
     */
    Set<String> findExistingUrls(Collection<String> urls);

    boolean exists(String url);

    /**
     * Inserts all listings atomically: either every listing is stored or none is.
     *
     * @return number of inserted rows
     */
    int insertAll(List<CarListing> listings);

    long count();

    List<CarListing> findRecent(int limit);
}
