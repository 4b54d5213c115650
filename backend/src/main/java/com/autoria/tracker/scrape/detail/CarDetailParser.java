package com.autoria.tracker.scrape.detail;

import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.model.ExtractionOutcome;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class CarDetailParser {
    private static final Logger log = LoggerFactory.getLogger(CarDetailParser.class);

    private final Clock clock;

    public CarDetailParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds a listing from a detail page. Optional fields fall back to their defaults; a page
     * without a title element is rejected as {@link ExtractionOutcome.Status#FAILED}.
     */
    public ExtractionOutcome parse(String url, String html) {
        if (html == null || html.isBlank()) {
            log.warn("Empty detail page for {}", url);
            return ExtractionOutcome.failed(url, ExtractionOutcome.REASON_MISSING_TITLE);
        }
        Document document = Jsoup.parse(html, url);
        if (!CarFields.TITLE.isPresent(document)) {
            log.warn("No {} element on detail page {}", CarFields.TITLE.name(), url);
            return ExtractionOutcome.failed(url, ExtractionOutcome.REASON_MISSING_TITLE);
        }

        List<String> missing = CarFields.missingFields(document);
        if (!missing.isEmpty()) {
            log.debug("Detail page {} has no {}; defaults used", url, missing);
        }

        CarListing listing = new CarListing(
            url,
            CarFields.TITLE.read(document),
            CarFields.PRICE_USD.read(document),
            CarFields.ODOMETER_KM.read(document),
            CarFields.SELLER_NAME.read(document),
            CarFields.PHONE_NUMBER.read(document),
            CarFields.IMAGE_URL.read(document),
            CarFields.IMAGES_COUNT.read(document),
            CarFields.VIN.read(document),
            CarFields.PLATE_NUMBER.read(document),
            clock.instant()
        );
        return ExtractionOutcome.success(listing);
    }
}
