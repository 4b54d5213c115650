package com.autoria.tracker.scrape.persistence;

import com.autoria.tracker.scrape.model.CarListing;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Repository
public class CarListingJdbcRepository implements CarListingStore {
    // Keeps the IN list under driver bind-parameter limits; a listing page is far below this.
    private static final int LOOKUP_CHUNK_SIZE = 1000;

    private static final RowMapper<CarListing> LISTING_ROW_MAPPER = (rs, rowNum) -> new CarListing(
        rs.getString("url"),
        rs.getString("title"),
        rs.getInt("price_usd"),
        rs.getInt("odometer_km"),
        rs.getString("username"),
        rs.getString("phone_number"),
        rs.getString("image_url"),
        rs.getInt("images_count"),
        rs.getString("car_vin"),
        rs.getString("car_number"),
        rs.getTimestamp("datetime_found").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public CarListingJdbcRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Set<String> findExistingUrls(Collection<String> urls) {
        Set<String> existing = new LinkedHashSet<>();
        if (urls == null || urls.isEmpty()) {
            return existing;
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(urls));
        for (int i = 0; i < distinct.size(); i += LOOKUP_CHUNK_SIZE) {
            List<String> chunk = distinct.subList(i, Math.min(distinct.size(), i + LOOKUP_CHUNK_SIZE));
            existing.addAll(jdbc.queryForList(
                """
                    SELECT url
                    FROM car_listings
                    WHERE url IN (:urls)
                    """,
                new MapSqlParameterSource().addValue("urls", chunk),
                String.class
            ));
        }
        return existing;
    }

    @Override
    public boolean exists(String url) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM car_listings WHERE url = :url",
            new MapSqlParameterSource().addValue("url", url),
            Integer.class
        );
        return count != null && count > 0;
    }

    @Override
    public int insertAll(List<CarListing> listings) {
        if (listings == null || listings.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource[] params = listings.stream()
            .map(this::toParams)
            .toArray(MapSqlParameterSource[]::new);
        Integer inserted = transactionTemplate.execute(status -> {
            int[] counts = jdbc.batchUpdate(
                """
                    INSERT INTO car_listings (
                        url, title, price_usd, odometer_km, username, phone_number,
                        image_url, images_count, car_vin, car_number, datetime_found
                    )
                    VALUES (
                        :url, :title, :priceUsd, :odometerKm, :username, :phoneNumber,
                        :imageUrl, :imagesCount, :carVin, :carNumber, :datetimeFound
                    )
                    """,
                params
            );
            int total = 0;
            for (int count : counts) {
                // Drivers may report SUCCESS_NO_INFO (-2) for batched statements.
                total += count < 0 ? 1 : count;
            }
            return total;
        });
        return inserted == null ? 0 : inserted;
    }

    @Override
    public long count() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM car_listings", Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public List<CarListing> findRecent(int limit) {
        return jdbc.query(
            """
                SELECT url, title, price_usd, odometer_km, username, phone_number,
                       image_url, images_count, car_vin, car_number, datetime_found
                FROM car_listings
                ORDER BY datetime_found DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            LISTING_ROW_MAPPER
        );
    }

    private MapSqlParameterSource toParams(CarListing listing) {
        return new MapSqlParameterSource()
            .addValue("url", listing.url())
            .addValue("title", listing.title())
            .addValue("priceUsd", listing.priceUsd())
            .addValue("odometerKm", listing.odometerKm())
            .addValue("username", listing.sellerName())
            .addValue("phoneNumber", listing.phoneNumber())
            .addValue("imageUrl", listing.imageUrl())
            .addValue("imagesCount", listing.imagesCount())
            .addValue("carVin", listing.vin())
            .addValue("carNumber", listing.plateNumber())
            .addValue("datetimeFound", Timestamp.from(listing.discoveredAt()));
    }
}
