package com.autoria.tracker.scrape.service;

import com.autoria.tracker.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dumps the PostgreSQL database with {@code pg_dump} into the configured backup directory.
 */
@Service
public class DatabaseBackupService {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBackupService.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm");
    private static final Pattern POSTGRES_URL =
        Pattern.compile("^jdbc:postgresql://([^:/?]+)(?::(\\d+))?/([^?;]+).*$");

    private final ScraperProperties properties;
    private final DataSourceProperties dataSourceProperties;
    private final Clock clock;

    public DatabaseBackupService(ScraperProperties properties, DataSourceProperties dataSourceProperties, Clock clock) {
        this.properties = properties;
        this.dataSourceProperties = dataSourceProperties;
        this.clock = clock;
    }

    public record PostgresTarget(String host, int port, String database) {
    }

    public Optional<Path> backup() {
        Optional<PostgresTarget> target = parseJdbcUrl(dataSourceProperties.getUrl());
        if (target.isEmpty()) {
            log.error("Database backup skipped: {} is not a PostgreSQL JDBC url", dataSourceProperties.getUrl());
            return Optional.empty();
        }
        Path file = backupFile();
        List<String> command = buildCommand(target.get(), dataSourceProperties.getUsername(), file);
        Map<String, String> environment = dataSourceProperties.getPassword() == null
            ? Map.of()
            : Map.of("PGPASSWORD", dataSourceProperties.getPassword());
        Duration timeout = Duration.ofMinutes(properties.getBackup().getTimeoutMinutes());
        if (!runDump(command, environment, logFileFor(file), timeout)) {
            return Optional.empty();
        }
        log.info("Backup created successfully: {}", file);
        return Optional.of(file);
    }

    /**
     * Runs the dump command with stdout and stderr sent to {@code logFile}. The process is killed
     * once {@code timeout} elapses. The log file is removed after a clean exit.
     */
    boolean runDump(List<String> command, Map<String, String> environment, Path logFile, Duration timeout) {
        Process process = null;
        try {
            Files.createDirectories(logFile.toAbsolutePath().getParent());
            ProcessBuilder builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile());
            builder.environment().putAll(environment);
            process = builder.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.error("Database backup timed out after {}", timeout);
                return false;
            }
            if (process.exitValue() != 0) {
                log.error("{} exited with {}: {}", command.get(0), process.exitValue(), readLog(logFile));
                return false;
            }
            Files.deleteIfExists(logFile);
            return true;
        } catch (IOException e) {
            log.error("Error running {}", command.get(0), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            log.warn("Database backup interrupted");
            return false;
        }
    }

    static Optional<PostgresTarget> parseJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return Optional.empty();
        }
        Matcher matcher = POSTGRES_URL.matcher(jdbcUrl.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int port = matcher.group(2) == null ? 5432 : Integer.parseInt(matcher.group(2));
        return Optional.of(new PostgresTarget(matcher.group(1), port, matcher.group(3)));
    }

    List<String> buildCommand(PostgresTarget target, String username, Path file) {
        return List.of(
            properties.getBackup().getPgDumpCommand(),
            "-h", target.host(),
            "-p", String.valueOf(target.port()),
            "-U", username == null ? "postgres" : username,
            "-d", target.database(),
            "-f", file.toString()
        );
    }

    static Path logFileFor(Path backupFile) {
        return backupFile.resolveSibling(backupFile.getFileName() + ".log");
    }

    private static String readLog(Path logFile) {
        try {
            return Files.readString(logFile, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            return "<output unavailable: " + e.getMessage() + ">";
        }
    }

    Path backupFile() {
        String stamp = FILE_STAMP.format(clock.instant().atZone(ZoneId.systemDefault()));
        return Paths.get(properties.getBackup().getDirectory()).toAbsolutePath().resolve("backup_" + stamp + ".sql");
    }
}
