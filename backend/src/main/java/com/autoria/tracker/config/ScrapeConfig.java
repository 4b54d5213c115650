package com.autoria.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for a scrape run. Detail pages share {@code scrapeExecutor}; the number of requests
 * actually on the wire is capped separately inside the HTTP client.
 */
@Configuration
public class ScrapeConfig {

    @Bean(name = "scrapeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scrapeExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxConcurrentRequests(), namedThreads("scrape-detail"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdownNow")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getMaxConcurrentRequests());
        return Executors.newFixedThreadPool(size, namedThreads("scrape-http"));
    }

    @Bean(name = "scrapeRunExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scrapeRunExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("scrape-run"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
