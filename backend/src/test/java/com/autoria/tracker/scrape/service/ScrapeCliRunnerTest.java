package com.autoria.tracker.scrape.service;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.model.ScrapeRunSummary;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapeCliRunnerTest {
    private final ScrapeOrchestratorService orchestrator = mock(ScrapeOrchestratorService.class);
    private final ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);

    @Test
    void doesNothingUnlessCliRunIsEnabled() {
        ScraperProperties properties = new ScraperProperties();

        new ScrapeCliRunner(properties, orchestrator, context).run(new DefaultApplicationArguments());

        verify(orchestrator, never()).run();
    }

    @Test
    void runsOneScrapeWhenEnabled() {
        ScraperProperties properties = new ScraperProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        Instant now = Instant.now();
        when(orchestrator.run()).thenReturn(new ScrapeRunSummary(
            now, now, ScrapeRunSummary.STATUS_COMPLETED, 1, 1, 0, 0, 0, Map.of(), Map.of(), Map.of(), null));

        new ScrapeCliRunner(properties, orchestrator, context).run(new DefaultApplicationArguments());

        verify(orchestrator).run();
    }
}
