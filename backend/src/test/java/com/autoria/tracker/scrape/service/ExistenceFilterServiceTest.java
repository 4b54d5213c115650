package com.autoria.tracker.scrape.service;

import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.persistence.InMemoryCarListingStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExistenceFilterServiceTest {
    private static final String KNOWN = "https://auto.ria.com/uk/auto_known_1.html";
    private static final String FRESH_A = "https://auto.ria.com/uk/auto_fresh_2.html";
    private static final String FRESH_B = "https://auto.ria.com/uk/auto_fresh_3.html";

    private final InMemoryCarListingStore store = new InMemoryCarListingStore();
    private final ExistenceFilterService service = new ExistenceFilterService(store);

    @Test
    void returnsOnlyUnknownUrlsInInputOrder() {
        store.seed(listing(KNOWN));

        assertThat(service.filterNew(List.of(FRESH_B, KNOWN, FRESH_A, FRESH_B)))
            .containsExactly(FRESH_B, FRESH_A);
        assertThat(store.bulkLookups()).isEqualTo(1);
    }

    @Test
    void lookupFailureTreatsEveryUrlAsNew() {
        store.seed(listing(KNOWN));
        store.failLookups(true);

        assertThat(service.filterNew(List.of(KNOWN, FRESH_A))).containsExactly(KNOWN, FRESH_A);
    }

    @Test
    void emptyInputSkipsTheLookup() {
        assertThat(service.filterNew(List.of())).isEmpty();
        assertThat(service.filterNew(Arrays.asList(null, " "))).isEmpty();
        assertThat(service.filterNew(null)).isEmpty();
        assertThat(store.bulkLookups()).isZero();
    }

    private static CarListing listing(String url) {
        return new CarListing(url, "Known car", 1000, 1000, "Seller", "", null, 0, "", "", Instant.now());
    }
}
