package com.autoria.tracker.scrape.detail;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.function.Function;

/**
 * A CSS locator paired with the function that turns the matched elements into a field value.
 * No match, or a reader returning null, yields the default value.
 */
public record FieldRule<T>(
    String name,
    String selector,
    Function<Elements, T> reader,
    T defaultValue
) {
    public T read(Document document) {
        Elements matches = document.select(selector);
        if (matches.isEmpty()) {
            return defaultValue;
        }
        T value = reader.apply(matches);
        return value == null ? defaultValue : value;
    }

    public boolean isPresent(Document document) {
        return document.selectFirst(selector) != null;
    }

    static <T> FieldRule<T> firstText(String name, String selector, Function<String, T> normalizer, T defaultValue) {
        return new FieldRule<>(name, selector, matches -> normalizer.apply(text(matches.first())), defaultValue);
    }

    static String text(Element element) {
        return element == null ? "" : element.text().trim();
    }
}
