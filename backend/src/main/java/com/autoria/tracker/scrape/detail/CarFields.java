package com.autoria.tracker.scrape.detail;

import com.autoria.tracker.scrape.model.CarListing;
import com.autoria.tracker.scrape.util.ListingTextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Locator table for the car detail page.
 */
public final class CarFields {
    public static final FieldRule<String> TITLE =
        FieldRule.firstText("title", "h1.head", Function.identity(), "");
    public static final FieldRule<Integer> PRICE_USD =
        FieldRule.firstText("price_usd", "div.price_value strong", ListingTextNormalizer::parsePrice, 0);
    public static final FieldRule<Integer> ODOMETER_KM =
        FieldRule.firstText("odometer_km", "div.base-information.bold", ListingTextNormalizer::parseOdometer, 0);
    public static final FieldRule<String> SELLER_NAME =
        FieldRule.firstText("username", "div.seller_info_name.bold", CarFields::blankToNull, CarListing.UNKNOWN_SELLER);
    public static final FieldRule<String> VIN =
        FieldRule.firstText("car_vin", "span.label-vin", Function.identity(), "");
    public static final FieldRule<String> PLATE_NUMBER =
        new FieldRule<>("car_number", "span.state-num.ua", matches -> leadingText(matches.first()), "");
    public static final FieldRule<String> PHONE_NUMBER =
        new FieldRule<>("phone_number", "div.phones_item span.phone.bold", CarFields::firstCanonicalPhone, "");
    public static final FieldRule<String> IMAGE_URL =
        new FieldRule<>("image_url", "div.photo-620x465 picture source", matches -> imageSource(matches.first()), null);
    public static final FieldRule<Integer> IMAGES_COUNT =
        new FieldRule<>("images_count", "div.photo-620x465 picture source", Elements::size, 0);

    public static final List<FieldRule<?>> ALL = List.of(
        TITLE, PRICE_USD, ODOMETER_KM, SELLER_NAME, VIN, PLATE_NUMBER, PHONE_NUMBER, IMAGE_URL, IMAGES_COUNT
    );

    private CarFields() {
    }

    /**
     * Names of the rules whose locator matches nothing on {@code document}, in table order.
     */
    public static List<String> missingFields(Document document) {
        List<String> missing = new ArrayList<>();
        for (FieldRule<?> rule : ALL) {
            if (!rule.isPresent(document)) {
                missing.add(rule.name());
            }
        }
        return missing;
    }

    private static String firstCanonicalPhone(Elements matches) {
        for (Element element : matches) {
            String phone = ListingTextNormalizer.parsePhone(FieldRule.text(element));
            if (!phone.isEmpty()) {
                return phone;
            }
        }
        return null;
    }

    // The plate badge nests the region flag after the number; only the leading text node is the plate.
    private static String leadingText(Element element) {
        if (element == null || element.childNodeSize() == 0) {
            return null;
        }
        Node first = element.childNode(0);
        if (first instanceof TextNode textNode) {
            return blankToNull(textNode.text().trim());
        }
        if (first instanceof Element child) {
            return blankToNull(child.text().trim());
        }
        return null;
    }

    private static String imageSource(Element element) {
        if (element == null) {
            return null;
        }
        for (String attribute : List.of("srcset", "src", "data-src")) {
            String value = element.attr(attribute).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
