package com.autoria.tracker.scrape.service;

import com.autoria.tracker.scrape.persistence.CarListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

@Service
public class ExistenceFilterService {
    private static final Logger log = LoggerFactory.getLogger(ExistenceFilterService.class);

    private final CarListingStore store;

    public ExistenceFilterService(CarListingStore store) {
        this.store = store;
    }

    /**
     * Returns the urls the store does not know yet, keeping input order. If the lookup fails every
     * url is returned; the unique constraint on insert then catches any duplicate.
     */
    public Set<String> filterNew(Collection<String> urls) {
        Set<String> candidates = new LinkedHashSet<>();
        if (urls == null) {
            return candidates;
        }
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                candidates.add(url);
            }
        }
        if (candidates.isEmpty()) {
            return candidates;
        }
        try {
            Set<String> existing = store.findExistingUrls(candidates);
            candidates.removeAll(existing);
            log.debug("Existence check: {} known, {} new", existing.size(), candidates.size());
            return candidates;
        } catch (RuntimeException e) {
            log.warn("Bulk existence check failed for {} urls; treating all as new", candidates.size(), e);
            return candidates;
        }
    }
}
