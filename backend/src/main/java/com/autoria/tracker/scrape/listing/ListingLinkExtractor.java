package com.autoria.tracker.scrape.listing;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls detail-page links out of a search results page, in document order.
 */
@Component
public class ListingLinkExtractor {
    static final String CARD_LINK_SELECTOR = "section.ticket-item a.address";

    public List<String> extract(String html) {
        return extract(html, "");
    }

    /**
     * Relative hrefs are resolved against {@code pageUrl}; absolute ones are returned as-is.
     */
    public List<String> extract(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        List<String> links = new ArrayList<>();
        for (Element anchor : document.select(CARD_LINK_SELECTOR)) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            links.add(absolute.isEmpty() ? href : absolute);
        }
        return links;
    }
}
