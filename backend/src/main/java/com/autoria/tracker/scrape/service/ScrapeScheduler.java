package com.autoria.tracker.scrape.service;

import com.autoria.tracker.config.ScraperProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires the daily scrape and database backup on their cron expressions. When both share the same
 * expression the backup runs right after the scrape instead of racing it.
 */
@Component
public class ScrapeScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScrapeScheduler.class);

    private final ScraperProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final DatabaseBackupService backupService;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public ScrapeScheduler(
        ScraperProperties properties,
        ScrapeOrchestratorService orchestratorService,
        DatabaseBackupService backupService,
        Clock clock
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.backupService = backupService;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        ScraperProperties.Schedule schedule = properties.getSchedule();
        ScraperProperties.Backup backup = properties.getBackup();
        if (!schedule.isEnabled() && !backup.isEnabled()) {
            log.info("Scheduling disabled; scrapes run only on demand");
            return;
        }
        synchronized (lifecycleLock) {
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "scrape-scheduler");
                thread.setDaemon(true);
                return thread;
            });
        }
        boolean backupWithScrape = schedule.isEnabled() && backup.isEnabled() && sameCron();
        if (schedule.isEnabled()) {
            scheduleNext("scraping_job", schedule.getCron(), () -> scheduledScrape(backupWithScrape));
        }
        if (backup.isEnabled() && !backupWithScrape) {
            scheduleNext("dump_job", backup.getCron(), this::scheduledBackup);
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                log.info("Shutting down scheduler...");
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }

    void scheduledScrape(boolean backupAfterwards) {
        log.info("Starting scheduled scraping");
        try {
            orchestratorService.run();
        } catch (ActiveScrapeRunException e) {
            log.warn("Scheduled scrape skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error during scheduled scraping", e);
        }
        if (backupAfterwards) {
            scheduledBackup();
        }
    }

    void scheduledBackup() {
        log.info("Starting database dump");
        backupService.backup().ifPresentOrElse(
            path -> log.info("Database dump completed successfully"),
            () -> log.warn("Database dump did not produce a file")
        );
    }

    static Duration delayUntilNext(CronExpression cron, ZonedDateTime now) {
        ZonedDateTime next = cron.next(now);
        if (next == null) {
            throw new IllegalStateException("Cron expression " + cron + " never fires again");
        }
        return Duration.between(now, next);
    }

    private void scheduleNext(String jobName, String cronText, Runnable job) {
        CronExpression cron = CronExpression.parse(cronText);
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone()));
        Duration delay = delayUntilNext(cron, now);
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            scheduler.schedule(() -> {
                try {
                    job.run();
                } finally {
                    scheduleNext(jobName, cronText, job);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Scheduled {} for {}", jobName, now.plus(delay));
    }

    private boolean sameCron() {
        String scrapeCron = properties.getSchedule().getCron();
        String backupCron = properties.getBackup().getCron();
        return scrapeCron != null && backupCron != null && scrapeCron.trim().equals(backupCron.trim());
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getSchedule().getZone());
    }
}
