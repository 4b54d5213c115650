package com.autoria.tracker.scrape.http;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GET-only client for listing and detail pages.
 *
 * <p>Every attempt is preceded by a random pause and uses a randomly chosen User-Agent. A shared
 * semaphore caps the number of requests in flight at {@code scraper.max-concurrent-requests},
 * whichever thread issues them. An exhausted retry budget yields {@link Optional#empty()}; callers
 * skip the unit of work instead of failing.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final ScraperProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger inFlightPeak = new AtomicInteger();

    public PoliteHttpClient(ScraperProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getMaxConcurrentRequests());
    }

    public Optional<String> fetch(String url) {
        int maxAttempts = properties.getRetryAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!sleepMs(nextJitterMs())) {
                return Optional.empty();
            }
            HttpFetchResult result = executeOnce(url, pickUserAgent());
            if (result.isSuccessful()) {
                return Optional.ofNullable(result.body());
            }
            if (result.errorCode() != null) {
                log.warn("Attempt {} failed for {}: {} {}", attempt, url, result.errorCode(), result.errorMessage());
                if ("interrupted".equals(result.errorCode()) || "invalid_url".equals(result.errorCode())) {
                    return Optional.empty();
                }
                continue;
            }
            if (result.isRateLimited()) {
                log.warn("Rate limited on attempt {} for {}", attempt, url);
                if (attempt < maxAttempts && !sleepMs((long) properties.getRateLimitBackoffMs() * attempt)) {
                    return Optional.empty();
                }
            } else {
                log.debug("Attempt {} for {} returned HTTP {}", attempt, url, result.statusCode());
            }
        }
        log.warn("Giving up on {} after {} attempts", url, maxAttempts);
        return Optional.empty();
    }

    public int inFlightPeak() {
        return inFlightPeak.get();
    }

    private HttpFetchResult executeOnce(String url, String userAgent) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, userAgent, startedAt, "invalid_url", "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            inFlightPeak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);

            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", userAgent)
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", "uk-UA,uk;q=0.9,en;q=0.8")
                .GET()
                .build();

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                userAgent,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, userAgent, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, userAgent, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, userAgent, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, userAgent, startedAt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                inFlight.decrementAndGet();
                globalLimiter.release();
            }
        }
    }

    private String pickUserAgent() {
        List<String> agents = properties.getUserAgents();
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }

    private long nextJitterMs() {
        int min = properties.getJitterMinMs();
        int max = properties.getJitterMaxMs();
        if (max <= min) {
            return min;
        }
        return ThreadLocalRandom.current().nextLong(min, max);
    }

    private boolean sleepMs(long ms) {
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, String userAgent, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            userAgent,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
