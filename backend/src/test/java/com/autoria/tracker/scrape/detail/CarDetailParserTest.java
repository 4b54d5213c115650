package com.autoria.tracker.scrape.detail;

import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.model.ExtractionOutcome;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CarDetailParserTest {
    private static final Instant NOW = Instant.parse("2026-10-19T15:44:00Z");
    private static final String URL = "https://auto.ria.com/uk/auto_volkswagen_passat_35000001.html";

    private final CarDetailParser parser = new CarDetailParser(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void extractsAllFieldsFromDetailPage() throws Exception {
        String html = Files.readString(Path.of("src/test/resources/fixtures/car-detail.html"));

        ExtractionOutcome outcome = parser.parse(URL, html);

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.SUCCESS);
        CarListing listing = outcome.listing();
        assertThat(listing.url()).isEqualTo(URL);
        assertThat(listing.title()).isEqualTo("Volkswagen Passat B8 2016");
        assertThat(listing.priceUsd()).isEqualTo(14500);
        assertThat(listing.odometerKm()).isEqualTo(185000);
        assertThat(listing.sellerName()).isEqualTo("Олександр");
        assertThat(listing.phoneNumber()).isEqualTo("+380671234567");
        assertThat(listing.vin()).isEqualTo("WVWZZZ3CZGE000001");
        assertThat(listing.plateNumber()).isEqualTo("AA 1234 BB");
        assertThat(listing.imageUrl()).isEqualTo("https://cdn.riastatic.com/photosnew/auto/photo/passat__1f.webp");
        assertThat(listing.imagesCount()).isEqualTo(3);
        assertThat(listing.discoveredAt()).isEqualTo(NOW);
    }

    @Test
    void missingOptionalElementsFallBackToDefaults() throws Exception {
        String html = Files.readString(Path.of("src/test/resources/fixtures/car-detail-minimal.html"));

        ExtractionOutcome outcome = parser.parse(URL, html);

        assertThat(outcome.isSuccess()).isTrue();
        CarListing listing = outcome.listing();
        assertThat(listing.title()).isEqualTo("Daewoo Lanos 2008");
        assertThat(listing.priceUsd()).isEqualTo(2911);
        assertThat(listing.odometerKm()).isZero();
        assertThat(listing.sellerName()).isEqualTo(CarListing.UNKNOWN_SELLER);
        assertThat(listing.phoneNumber()).isEmpty();
        assertThat(listing.imageUrl()).isNull();
        assertThat(listing.imagesCount()).isZero();
        assertThat(listing.vin()).isEmpty();
        assertThat(listing.plateNumber()).isEmpty();
    }

    @Test
    void imageFallsBackToSrcWhenSrcsetIsMissing() {
        String html = """
            <h1 class="head">Audi A4</h1>
            <div class="photo-620x465"><picture><source src="https://cdn.example/a4.jpg"></picture></div>
            """;

        CarListing listing = parser.parse(URL, html).listing();

        assertThat(listing.imageUrl()).isEqualTo("https://cdn.example/a4.jpg");
        assertThat(listing.imagesCount()).isEqualTo(1);
    }

    @Test
    void pageWithoutTitleFailsWithoutListing() {
        String html = "<div class=\"price_value\"><strong>5 000 $</strong></div>";

        ExtractionOutcome outcome = parser.parse(URL, html);

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.FAILED);
        assertThat(outcome.reason()).isEqualTo(ExtractionOutcome.REASON_MISSING_TITLE);
        assertThat(outcome.listing()).isNull();
    }

    @Test
    void blankPageFails() {
        assertThat(parser.parse(URL, " ").status()).isEqualTo(ExtractionOutcome.Status.FAILED);
    }
}
