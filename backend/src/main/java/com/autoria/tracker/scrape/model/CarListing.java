package com.autoria.tracker.scrape.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * One used-car listing extracted from a detail page. The url is the listing's identity across runs.
 */
@JsonPropertyOrder({
    "url", "title", "price_usd", "odometer_km", "username", "phone_number",
    "image_url", "images_count", "car_vin", "car_number", "datetime_found"
})
public record CarListing(
    @JsonProperty("url") String url,
    @JsonProperty("title") String title,
    @JsonProperty("price_usd") int priceUsd,
    @JsonProperty("odometer_km") int odometerKm,
    @JsonProperty("username") String sellerName,
    @JsonProperty("phone_number") String phoneNumber,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("images_count") int imagesCount,
    @JsonProperty("car_vin") String vin,
    @JsonProperty("car_number") String plateNumber,
    @JsonProperty("datetime_found") Instant discoveredAt
) {
    public static final String UNKNOWN_SELLER = "Unknown";

    public CarListing {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (discoveredAt == null) {
            throw new IllegalArgumentException("discoveredAt is required");
        }
        priceUsd = Math.max(0, priceUsd);
        odometerKm = Math.max(0, odometerKm);
        imagesCount = Math.max(0, imagesCount);
        title = title == null ? "" : title;
        sellerName = sellerName == null || sellerName.isBlank() ? UNKNOWN_SELLER : sellerName;
        phoneNumber = phoneNumber == null ? "" : phoneNumber;
        vin = vin == null ? "" : vin;
        plateNumber = plateNumber == null ? "" : plateNumber;
    }
}
