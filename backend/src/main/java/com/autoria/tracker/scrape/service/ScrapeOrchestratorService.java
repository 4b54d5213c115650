package com.autoria.tracker.scrape.service;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.detail.CarDetailService;
import com.autoria.tracker.scrape.http.PoliteHttpClient;
import com.autoria.tracker.scrape.listing.ListingLinkExtractor;
import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.model.ExtractionOutcome;
import com.autoria.tracker.scrape.model.ScrapePhase;
import com.autoria.tracker.scrape.model.ScrapeRunSummary;
import com.autoria.tracker.scrape.output.ListingSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one scrape: discover links page by page, drop known urls, fetch and extract the rest in
 * parallel, then hand the batch to every enabled sink. Only one run may be active at a time.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final ScraperProperties properties;
    private final PoliteHttpClient httpClient;
    private final ListingLinkExtractor linkExtractor;
    private final ExistenceFilterService existenceFilter;
    private final CarDetailService detailService;
    private final List<ListingSink> sinks;
    private final ExecutorService scrapeExecutor;
    private final ExecutorService scrapeRunExecutor;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ScrapeRunSummary> lastSummary = new AtomicReference<>();

    public ScrapeOrchestratorService(
        ScraperProperties properties,
        PoliteHttpClient httpClient,
        ListingLinkExtractor linkExtractor,
        ExistenceFilterService existenceFilter,
        CarDetailService detailService,
        List<ListingSink> sinks,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.linkExtractor = linkExtractor;
        this.existenceFilter = existenceFilter;
        this.detailService = detailService;
        this.sinks = List.copyOf(sinks);
        this.scrapeExecutor = scrapeExecutor;
        this.scrapeRunExecutor = scrapeRunExecutor;
        this.clock = clock;
    }

    public ScrapeRunSummary run() {
        claimRun();
        try {
            return runClaimed();
        } finally {
            running.set(false);
        }
    }

    public Instant startAsync() {
        claimRun();
        Instant requestedAt = clock.instant();
        try {
            scrapeRunExecutor.submit(() -> {
                try {
                    runClaimed();
                } catch (RuntimeException e) {
                    log.error("Async scrape run failed", e);
                } finally {
                    running.set(false);
                }
            });
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return requestedAt;
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<ScrapeRunSummary> lastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    private void claimRun() {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveScrapeRunException("A scrape run is already in progress");
        }
    }

    private ScrapeRunSummary runClaimed() {
        RunState state = new RunState(clock.instant());
        log.info("Starting the scraper: pages {}..{} from {}",
            properties.getStartPage(),
            properties.getStartPage() + properties.getMaxPages() - 1,
            properties.getStartUrl());
        try {
            Set<String> candidates = discoverAndFilter(state);
            List<CarListing> batch = fetchAndExtract(candidates, state);
            persist(batch, state);
            ScrapeRunSummary summary = state.toSummary(clock.instant(), ScrapeRunSummary.STATUS_COMPLETED, null);
            lastSummary.set(summary);
            log.info(
                "Scraping completed in {}. Total cars collected: {} (pages={}, links={}, new={}, skipped={}, failed={})",
                Duration.between(summary.startedAt(), summary.finishedAt()),
                summary.extracted(),
                summary.pagesFetched(),
                summary.linksDiscovered(),
                summary.newLinks(),
                summary.skippedByReason(),
                summary.failedByReason()
            );
            return summary;
        } catch (RuntimeException e) {
            log.error("Scrape run aborted during {}", state.phase, e);
            lastSummary.set(state.toSummary(clock.instant(), ScrapeRunSummary.STATUS_FAILED, e.getMessage()));
            throw e;
        }
    }

    private Set<String> discoverAndFilter(RunState state) {
        Set<String> scheduled = new LinkedHashSet<>();
        int firstPage = properties.getStartPage();
        int lastPage = firstPage + properties.getMaxPages() - 1;
        for (int page = firstPage; page <= lastPage; page++) {
            state.enter(ScrapePhase.DISCOVER);
            state.pagesRequested++;
            String pageUrl = properties.listingPageUrl(page);
            Optional<String> html = httpClient.fetch(pageUrl);
            if (html.isEmpty()) {
                log.warn("Listing page {} unavailable, skipping", pageUrl);
                continue;
            }
            state.pagesFetched++;
            List<String> links = linkExtractor.extract(html.get(), pageUrl);
            state.linksDiscovered += links.size();
            if (links.isEmpty()) {
                log.info("No car links on page {}", page);
                continue;
            }

            state.enter(ScrapePhase.FILTER);
            Set<String> fresh = existenceFilter.filterNew(links);
            int added = 0;
            for (String url : fresh) {
                if (scheduled.add(url)) {
                    added++;
                }
            }
            log.info("Page {}: {} links, {} new", page, links.size(), added);
        }
        state.newLinks = scheduled.size();
        return scheduled;
    }

    private List<CarListing> fetchAndExtract(Set<String> candidates, RunState state) {
        state.enter(ScrapePhase.FETCH_EXTRACT);
        List<CompletableFuture<ExtractionOutcome>> futures = new ArrayList<>(candidates.size());
        for (String url : candidates) {
            futures.add(CompletableFuture
                .supplyAsync(() -> detailService.extract(url), scrapeExecutor)
                .exceptionally(e -> {
                    log.error("Unexpected failure extracting {}", url, e);
                    return ExtractionOutcome.failed(url, ExtractionOutcome.REASON_UNEXPECTED_ERROR);
                }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        state.enter(ScrapePhase.AGGREGATE);
        List<CarListing> batch = new ArrayList<>();
        for (CompletableFuture<ExtractionOutcome> future : futures) {
            ExtractionOutcome outcome = future.join();
            switch (outcome.status()) {
                case SUCCESS -> batch.add(outcome.listing());
                case SKIPPED -> state.skippedByReason.merge(outcome.reason(), 1, Integer::sum);
                case FAILED -> state.failedByReason.merge(outcome.reason(), 1, Integer::sum);
            }
        }
        state.extracted = batch.size();
        return batch;
    }

    private void persist(List<CarListing> batch, RunState state) {
        state.enter(ScrapePhase.PERSIST);
        if (batch.isEmpty()) {
            log.info("No new cars collected; nothing to persist");
            return;
        }
        for (ListingSink sink : sinks) {
            if (!sink.isEnabled()) {
                continue;
            }
            try {
                state.writtenBySink.put(sink.name(), sink.write(batch));
            } catch (RuntimeException e) {
                log.error("Sink {} failed for {} cars", sink.name(), batch.size(), e);
                state.writtenBySink.put(sink.name(), 0);
            }
        }
    }

    private static final class RunState {
        private final Instant startedAt;
        private ScrapePhase phase;
        private int pagesRequested;
        private int pagesFetched;
        private int linksDiscovered;
        private int newLinks;
        private int extracted;
        private final Map<String, Integer> skippedByReason = new LinkedHashMap<>();
        private final Map<String, Integer> failedByReason = new LinkedHashMap<>();
        private final Map<String, Integer> writtenBySink = new LinkedHashMap<>();

        private RunState(Instant startedAt) {
            this.startedAt = startedAt;
        }

        private void enter(ScrapePhase next) {
            if (phase != next) {
                log.debug("Scrape phase {} -> {}", phase, next);
                phase = next;
            }
        }

        private ScrapeRunSummary toSummary(Instant finishedAt, String status, String errorMessage) {
            return new ScrapeRunSummary(
                startedAt,
                finishedAt,
                status,
                pagesRequested,
                pagesFetched,
                linksDiscovered,
                newLinks,
                extracted,
                Map.copyOf(skippedByReason),
                Map.copyOf(failedByReason),
                Map.copyOf(writtenBySink),
                errorMessage
            );
        }
    }
}
