package com.autoria.tracker.scrape.output;

import com.autoria.tracker.config.ScraperProperties;
import com.autoria.tracker.scrape.model.CarListing;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonDumpSinkTest {
    private static final Instant NOW = Instant.parse("2026-10-19T15:44:05Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private JsonDumpSink sink;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.getOutput().setDumpsDir(tempDir.resolve("dumps").toString());
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        sink = new JsonDumpSink(properties, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void writesBatchWithStableFieldNames() throws Exception {
        CarListing car = new CarListing(
            "https://auto.ria.com/uk/auto_volkswagen_passat_35000001.html",
            "Volkswagen Passat B8 2016",
            14500,
            185000,
            "Олександр",
            "+380671234567",
            "https://cdn.riastatic.com/photo.webp",
            3,
            "WVWZZZ3CZGE000001",
            "AA 1234 BB",
            NOW
        );

        int written = sink.write(List.of(car));

        assertThat(written).isEqualTo(1);
        Path dump = sink.dumpPath();
        assertThat(dump.getFileName().toString()).startsWith("cars_dump_").endsWith(".json");
        assertThat(Files.exists(dump)).isTrue();

        JsonNode root = objectMapper.readTree(Files.readString(dump));
        assertThat(root.isArray()).isTrue();
        JsonNode first = root.get(0);
        List<String> keys = new ArrayList<>();
        Iterator<String> names = first.fieldNames();
        names.forEachRemaining(keys::add);
        assertThat(keys).containsExactly(
            "url", "title", "price_usd", "odometer_km", "username", "phone_number",
            "image_url", "images_count", "car_vin", "car_number", "datetime_found"
        );
        assertThat(first.get("price_usd").asInt()).isEqualTo(14500);
        assertThat(first.get("username").asText()).isEqualTo("Олександр");
        assertThat(first.get("datetime_found").asText()).isEqualTo("2026-10-19T15:44:05Z");
    }

    @Test
    void missingImageIsWrittenAsNull() throws Exception {
        CarListing car = new CarListing("https://auto.ria.com/uk/auto_x_1.html", "X", 0, 0, null, null, null, 0, null, null, NOW);

        sink.write(List.of(car));

        JsonNode first = objectMapper.readTree(Files.readString(sink.dumpPath())).get(0);
        assertThat(first.get("image_url").isNull()).isTrue();
        assertThat(first.get("username").asText()).isEqualTo("Unknown");
    }

    @Test
    void emptyBatchWritesNoFile() {
        assertThat(sink.write(List.of())).isZero();
        assertThat(Files.exists(sink.dumpPath())).isFalse();
    }
}
