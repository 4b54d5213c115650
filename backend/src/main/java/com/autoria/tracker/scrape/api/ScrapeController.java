package com.autoria.tracker.scrape.api;

import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.model.ScrapeStatusResponse;
import com.autoria.tracker.scrape.persistence.CarListingStore;
import com.autoria.tracker.scrape.service.ScrapeOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private static final int MAX_LISTINGS_LIMIT = 200;

    private final ScrapeOrchestratorService orchestratorService;
    private final CarListingStore store;

    public ScrapeController(ScrapeOrchestratorService orchestratorService, CarListingStore store) {
        this.orchestratorService = orchestratorService;
        this.store = store;
    }

    @PostMapping("/scrape/run")
    public ResponseEntity<Map<String, String>> startScrape() {
        Instant requestedAt = orchestratorService.startAsync();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("status", "accepted", "requestedAt", requestedAt.toString()));
    }

    @GetMapping("/scrape/status")
    public ScrapeStatusResponse status() {
        return new ScrapeStatusResponse(orchestratorService.isRunning(), orchestratorService.lastSummary().orElse(null));
    }

    @GetMapping("/listings")
    public List<CarListing> recentListings(
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        int safeLimit = Math.max(1, Math.min(MAX_LISTINGS_LIMIT, limit));
        return store.findRecent(safeLimit);
    }

    @GetMapping("/listings/count")
    public Map<String, Long> listingCount() {
        return Map.of("count", store.count());
    }
}
