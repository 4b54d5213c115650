package com.autoria.tracker.scrape.output;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.persistence.CarListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Inserts the batch in one transaction. A failed insert drops the whole batch; there is no
 * per-listing fallback and no retry.
 */
@Component
@Order(2)
public class DatabaseListingSink implements ListingSink {
    private static final Logger log = LoggerFactory.getLogger(DatabaseListingSink.class);

    private final ScraperProperties properties;
    private final CarListingStore store;

    public DatabaseListingSink(ScraperProperties properties, CarListingStore store) {
        this.properties = properties;
        this.store = store;
    }

    @Override
    public String name() {
        return "database";
    }

    @Override
    public boolean isEnabled() {
        return properties.getOutput().isSaveToDb();
    }

    @Override
    public int write(List<CarListing> listings) {
        if (listings == null || listings.isEmpty()) {
            return 0;
        }
        try {
            int inserted = store.insertAll(listings);
            log.info("Saved {} cars to the database", inserted);
            return inserted;
        } catch (RuntimeException e) {
            log.error("Error saving {} cars, batch dropped", listings.size(), e);
            return 0;
        }
    }
}
