package com.autoria.tracker.scrape.util;

import java.util.List;
import java.util.Locale;

public final class ListingUrlClassifier {
    private static final List<String> NEW_CAR_HINTS = List.of("newauto");

    private ListingUrlClassifier() {
    }

    /**
     * New-car dealer pages share the listing grid with used cars but have a different layout and
     * are not tracked.
     */
    public static boolean isNewCarUrl(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (String hint : NEW_CAR_HINTS) {
            if (lower.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
