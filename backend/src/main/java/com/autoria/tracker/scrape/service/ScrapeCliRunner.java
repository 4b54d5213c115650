package com.autoria.tracker.scrape.service;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.model.ScrapeRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            ScrapeRunSummary summary = orchestratorService.run();
            log.info(
                "Scrape run finished with status {}: extracted={}, written={}, skipped={}, failed={}",
                summary.status(),
                summary.extracted(),
                summary.writtenBySink(),
                summary.skippedByReason(),
                summary.failedByReason()
            );
        } catch (RuntimeException e) {
            log.error("Scrape run failed", e);
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalExitCode));
        }
    }
}
