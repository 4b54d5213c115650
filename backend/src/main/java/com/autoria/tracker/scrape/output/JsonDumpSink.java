package com.autoria.tracker.scrape.output;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.model.CarListing;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes each batch as a JSON array to {@code {dumps-dir}/cars_dump_{yyyyMMdd_HHmmss}.json}.
 */
@Component
@Order(1)
public class JsonDumpSink implements ListingSink {
    private static final Logger log = LoggerFactory.getLogger(JsonDumpSink.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ScraperProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonDumpSink(ScraperProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public boolean isEnabled() {
        return properties.getOutput().isSaveToJson();
    }

    @Override
    public int write(List<CarListing> listings) {
        if (listings == null || listings.isEmpty()) {
            return 0;
        }
        Path target = dumpPath();
        ObjectWriter writer = properties.getOutput().getJsonIndent() > 0
            ? objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT)
            : objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(target.getParent());
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                writer.writeValue(out, listings);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON dump " + target, e);
        }
        log.info("Saved {} cars to {}", listings.size(), target);
        return listings.size();
    }

    Path dumpPath() {
        String stamp = FILE_STAMP.format(clock.instant().atZone(ZoneId.systemDefault()));
        return Paths.get(properties.getOutput().getDumpsDir()).toAbsolutePath().resolve("cars_dump_" + stamp + ".json");
    }
}
