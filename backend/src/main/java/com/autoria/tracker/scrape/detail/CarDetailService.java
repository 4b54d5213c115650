package com.autoria.tracker.scrape.detail;

import com.autoria.tracker.scrape.http.PoliteHttpClient;
import com.autoria.tracker.scrape.model.ExtractionOutcome;
import com.autoria.tracker.scrape.persistence.CarListingStore;
import com.autoria.tracker.scrape.util.ListingUrlClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class CarDetailService {
    private static final Logger log = LoggerFactory.getLogger(CarDetailService.class);

    private final PoliteHttpClient httpClient;
    private final CarListingStore store;
    private final CarDetailParser parser;

    public CarDetailService(PoliteHttpClient httpClient, CarListingStore store, CarDetailParser parser) {
        this.httpClient = httpClient;
        this.store = store;
        this.parser = parser;
    }

    public ExtractionOutcome extract(String url) {
        if (ListingUrlClassifier.isNewCarUrl(url)) {
            log.debug("Skipping new car page: {}", url);
            return ExtractionOutcome.skipped(url, ExtractionOutcome.REASON_NEW_CAR);
        }
        // The batch filter ran earlier; another run may have stored this url since.
        if (isAlreadyStored(url)) {
            log.debug("Skipping already stored car: {}", url);
            return ExtractionOutcome.skipped(url, ExtractionOutcome.REASON_ALREADY_STORED);
        }

        Optional<String> html = httpClient.fetch(url);
        if (html.isEmpty()) {
            log.info("Detail page unavailable, skipping: {}", url);
            return ExtractionOutcome.skipped(url, ExtractionOutcome.REASON_FETCH_UNAVAILABLE);
        }

        try {
            return parser.parse(url, html.get());
        } catch (RuntimeException e) {
            log.error("Error parsing car page {}", url, e);
            return ExtractionOutcome.failed(url, ExtractionOutcome.REASON_PARSE_ERROR);
        }
    }

    private boolean isAlreadyStored(String url) {
        try {
            return store.exists(url);
        } catch (RuntimeException e) {
            log.warn("Existence check failed for {}; treating as new", url, e);
            return false;
        }
    }
}
