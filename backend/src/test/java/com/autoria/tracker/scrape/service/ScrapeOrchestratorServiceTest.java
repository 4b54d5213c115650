package com.autoria.tracker.scrape.service;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.detail.CarDetailParser;
import com.autoria.tracker.scrape.detail.CarDetailService;
import com.autoria.tracker.scrape.http.PoliteHttpClient;
import com.autoria.tracker.scrape.listing.ListingLinkExtractor;
import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.model.ExtractionOutcome;
import com.autoria.tracker.scrape.model.ScrapeRunSummary;
import com.autoria.tracker.scrape.output.DatabaseListingSink;
import com.autoria.tracker.scrape.output.ListingSink;
import com.autoria.tracker.scrape.persistence.InMemoryCarListingStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapeOrchestratorServiceTest {
    private static final String START_URL = "https://auto.ria.com/uk/car/used/";
    private static final String KNOWN = "https://auto.ria.com/uk/auto_known_1.html";
    private static final String GOOD = "https://auto.ria.com/uk/auto_good_2.html";
    private static final String BROKEN = "https://auto.ria.com/uk/auto_broken_3.html";

    private ScraperProperties properties;
    private PoliteHttpClient httpClient;
    private InMemoryCarListingStore store;
    private ExecutorService scrapeExecutor;
    private ExecutorService runExecutor;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.setStartUrl(START_URL);
        properties.setMaxPages(1);
        properties.setMaxConcurrentRequests(3);
        httpClient = Mockito.mock(PoliteHttpClient.class);
        store = new InMemoryCarListingStore();
        store.seed(new CarListing(KNOWN, "Known", 1, 1, "Seller", "", null, 0, "", "", Instant.now()));
        scrapeExecutor = Executors.newFixedThreadPool(3);
        runExecutor = Executors.newSingleThreadExecutor();

        when(httpClient.fetch(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.equals(START_URL + "?page=1")) {
                return Optional.of(listingPage(KNOWN, GOOD, BROKEN));
            }
            if (url.equals(GOOD)) {
                return Optional.of("<h1 class=\"head\">Renault Megane 2015</h1>"
                    + "<div class=\"price_value\"><strong>8 200 $</strong></div>");
            }
            if (url.equals(BROKEN)) {
                return Optional.of("<html><body>Access denied</body></html>");
            }
            return Optional.empty();
        });
    }

    @AfterEach
    void tearDown() {
        scrapeExecutor.shutdownNow();
        runExecutor.shutdownNow();
    }

    @Test
    void collectsOnlyNewSuccessfullyExtractedCars() {
        RecordingSink sink = new RecordingSink("recording");
        ScrapeOrchestratorService service = orchestrator(List.of(sink));

        ScrapeRunSummary summary = service.run();

        assertThat(summary.status()).isEqualTo(ScrapeRunSummary.STATUS_COMPLETED);
        assertThat(summary.pagesFetched()).isEqualTo(1);
        assertThat(summary.linksDiscovered()).isEqualTo(3);
        assertThat(summary.newLinks()).isEqualTo(2);
        assertThat(summary.extracted()).isEqualTo(1);
        assertThat(summary.failedByReason()).containsEntry(ExtractionOutcome.REASON_MISSING_TITLE, 1);
        assertThat(sink.batches).hasSize(1);
        CarListing car = sink.batches.get(0).get(0);
        assertThat(car.url()).isEqualTo(GOOD);
        assertThat(car.priceUsd()).isEqualTo(8200);
        assertThat(summary.writtenBySink()).containsEntry("recording", 1);
        verify(httpClient, never()).fetch(KNOWN);
        assertThat(service.lastSummary()).contains(summary);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void detailPageThatStaysUnavailableIsSkippedAndRestOfBatchIsKept() {
        doReturn(Optional.empty()).when(httpClient).fetch(BROKEN);
        RecordingSink sink = new RecordingSink("recording");

        ScrapeRunSummary summary = orchestrator(List.of(sink)).run();

        verify(httpClient, times(1)).fetch(GOOD);
        verify(httpClient, times(1)).fetch(BROKEN);
        verify(httpClient, never()).fetch(KNOWN);
        assertThat(summary.newLinks()).isEqualTo(2);
        assertThat(summary.extracted()).isEqualTo(1);
        assertThat(summary.skippedByReason()).containsEntry(ExtractionOutcome.REASON_FETCH_UNAVAILABLE, 1);
        assertThat(summary.failedByReason()).isEmpty();
        assertThat(sink.batches).hasSize(1);
        assertThat(sink.batches.get(0)).extracting(CarListing::url).containsExactly(GOOD);
    }

    @Test
    void secondRunFindsNothingNew() {
        DatabaseListingSink databaseSink = new DatabaseListingSink(properties, store);
        ScrapeOrchestratorService service = orchestrator(List.of(databaseSink));

        assertThat(service.run().writtenBySink()).containsEntry("database", 1);
        long storedAfterFirstRun = store.count();

        ScrapeRunSummary second = service.run();

        assertThat(second.extracted()).isZero();
        assertThat(second.writtenBySink()).isEmpty();
        assertThat(store.count()).isEqualTo(storedAfterFirstRun);
    }

    @Test
    void unavailableListingPageIsSkipped() {
        when(httpClient.fetch(START_URL + "?page=1")).thenReturn(Optional.empty());
        RecordingSink sink = new RecordingSink("recording");

        ScrapeRunSummary summary = orchestrator(List.of(sink)).run();

        assertThat(summary.pagesRequested()).isEqualTo(1);
        assertThat(summary.pagesFetched()).isZero();
        assertThat(summary.newLinks()).isZero();
        assertThat(sink.batches).isEmpty();
    }

    @Test
    void failingSinkDoesNotStopTheOthers() {
        ListingSink failing = new RecordingSink("failing") {
            @Override
            public int write(List<CarListing> listings) {
                throw new IllegalStateException("disk full");
            }
        };
        RecordingSink healthy = new RecordingSink("healthy");

        ScrapeRunSummary summary = orchestrator(List.of(failing, healthy)).run();

        assertThat(summary.status()).isEqualTo(ScrapeRunSummary.STATUS_COMPLETED);
        assertThat(summary.writtenBySink()).containsEntry("failing", 0).containsEntry("healthy", 1);
        assertThat(healthy.batches).hasSize(1);
    }

    @Test
    void secondConcurrentRunIsRejected() throws Exception {
        CountDownLatch pageRequested = new CountDownLatch(1);
        CountDownLatch releasePage = new CountDownLatch(1);
        when(httpClient.fetch(START_URL + "?page=1")).thenAnswer(invocation -> {
            pageRequested.countDown();
            releasePage.await(5, TimeUnit.SECONDS);
            return Optional.empty();
        });
        ScrapeOrchestratorService service = orchestrator(List.of(new RecordingSink("recording")));

        CompletableFuture<ScrapeRunSummary> first = CompletableFuture.supplyAsync(service::run);
        assertThat(pageRequested.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.isRunning()).isTrue();
        assertThatThrownBy(service::run).isInstanceOf(ActiveScrapeRunException.class);
        assertThatThrownBy(service::startAsync).isInstanceOf(ActiveScrapeRunException.class);

        releasePage.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(ScrapeRunSummary.STATUS_COMPLETED);
        assertThat(service.isRunning()).isFalse();
    }

    private ScrapeOrchestratorService orchestrator(List<ListingSink> sinks) {
        CarDetailService detailService = new CarDetailService(httpClient, store, new CarDetailParser(Clock.systemUTC()));
        return new ScrapeOrchestratorService(
            properties,
            httpClient,
            new ListingLinkExtractor(),
            new ExistenceFilterService(store),
            detailService,
            sinks,
            scrapeExecutor,
            runExecutor,
            Clock.systemUTC()
        );
    }

    private static String listingPage(String... urls) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (String url : urls) {
            html.append("<section class=\"ticket-item\"><a class=\"address\" href=\"")
                .append(url)
                .append("\">car</a></section>");
        }
        return html.append("</body></html>").toString();
    }

    private static class RecordingSink implements ListingSink {
        private final String name;
        private final List<List<CarListing>> batches = new ArrayList<>();

        RecordingSink(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public int write(List<CarListing> listings) {
            batches.add(List.copyOf(listings));
            return listings.size();
        }
    }
}
