package com.autoria.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_START_URL = "https://auto.ria.com/uk/car/used/";
    private static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) Chrome/91.0.4472.124",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) Firefox/89.0"
    );

    private String startUrl = DEFAULT_START_URL;
    private int startPage = 1;
    private int maxPages = 7;
    private int maxConcurrentRequests = 20;
    private int retryAttempts = 2;
    private int requestTimeoutSeconds = 10;
    private int jitterMinMs = 500;
    private int jitterMaxMs = 1500;
    private int rateLimitBackoffMs = 5000;
    private List<String> userAgents = new ArrayList<>(DEFAULT_USER_AGENTS);
    private Output output = new Output();
    private Schedule schedule = new Schedule();
    private Backup backup = new Backup();
    private Cli cli = new Cli();

    public String getStartUrl() {
        return startUrl;
    }

    public void setStartUrl(String startUrl) {
        this.startUrl = startUrl == null || startUrl.isBlank() ? DEFAULT_START_URL : startUrl.trim();
    }

    public int getStartPage() {
        return startPage;
    }

    public void setStartPage(int startPage) {
        this.startPage = Math.max(1, startPage);
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(0, maxPages);
    }

    public int getMaxConcurrentRequests() {
        return Math.max(1, maxConcurrentRequests);
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
    }

    public int getRetryAttempts() {
        return Math.max(1, retryAttempts);
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = Math.max(1, retryAttempts);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getJitterMinMs() {
        return jitterMinMs;
    }

    public void setJitterMinMs(int jitterMinMs) {
        this.jitterMinMs = Math.max(0, jitterMinMs);
    }

    public int getJitterMaxMs() {
        return Math.max(jitterMinMs, jitterMaxMs);
    }

    public void setJitterMaxMs(int jitterMaxMs) {
        this.jitterMaxMs = Math.max(0, jitterMaxMs);
    }

    public int getRateLimitBackoffMs() {
        return rateLimitBackoffMs;
    }

    public void setRateLimitBackoffMs(int rateLimitBackoffMs) {
        this.rateLimitBackoffMs = Math.max(0, rateLimitBackoffMs);
    }

    public List<String> getUserAgents() {
        return userAgents;
    }

    public void setUserAgents(List<String> userAgents) {
        List<String> cleaned = new ArrayList<>();
        if (userAgents != null) {
            for (String agent : userAgents) {
                if (agent != null && !agent.isBlank()) {
                    cleaned.add(agent.trim());
                }
            }
        }
        this.userAgents = cleaned.isEmpty() ? new ArrayList<>(DEFAULT_USER_AGENTS) : cleaned;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Backup getBackup() {
        return backup;
    }

    public void setBackup(Backup backup) {
        this.backup = backup;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public String listingPageUrl(int page) {
        String separator = startUrl.contains("?") ? "&" : "?";
        return startUrl + separator + "page=" + page;
    }

    public static class Output {
        private boolean saveToJson = true;
        private boolean saveToDb = true;
        private String dumpsDir = "dumps";
        private int jsonIndent = 2;

        public boolean isSaveToJson() {
            return saveToJson;
        }

        public void setSaveToJson(boolean saveToJson) {
            this.saveToJson = saveToJson;
        }

        public boolean isSaveToDb() {
            return saveToDb;
        }

        public void setSaveToDb(boolean saveToDb) {
            this.saveToDb = saveToDb;
        }

        public String getDumpsDir() {
            return dumpsDir;
        }

        public void setDumpsDir(String dumpsDir) {
            this.dumpsDir = dumpsDir == null || dumpsDir.isBlank() ? "dumps" : dumpsDir.trim();
        }

        public int getJsonIndent() {
            return jsonIndent;
        }

        public void setJsonIndent(int jsonIndent) {
            this.jsonIndent = Math.max(0, jsonIndent);
        }
    }

    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 44 18 * * *";
        private String zone = "Europe/Kiev";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Backup {
        private boolean enabled = false;
        private String cron = "0 45 18 * * *";
        private String directory = "database_backups";
        private String pgDumpCommand = "pg_dump";
        private int timeoutMinutes = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getPgDumpCommand() {
            return pgDumpCommand;
        }

        public void setPgDumpCommand(String pgDumpCommand) {
            this.pgDumpCommand = pgDumpCommand;
        }

        public int getTimeoutMinutes() {
            return Math.max(1, timeoutMinutes);
        }

        public void setTimeoutMinutes(int timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
