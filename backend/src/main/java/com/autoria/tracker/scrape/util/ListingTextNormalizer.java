package com.autoria.tracker.scrape.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw text fragments from listing pages into canonical values. None of these methods
 * throw: missing or unreadable input maps to 0 or an empty string.
 */
public final class ListingTextNormalizer {
    static final double EUR_TO_USD = 1.1;
    static final double UAH_PER_USD = 41.22;

    // Thousands groups may be split by a regular or a non-breaking space.
    private static final Pattern ODOMETER =
        Pattern.compile("(\\d+(?:[\\s\\u00a0]\\d{3})*)[\\s\\u00a0]*(тис\\.?|тыс\\.?|км)?");
    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0]+");

    private ListingTextNormalizer() {
    }

    public static int parseOdometer(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        Matcher matcher = ODOMETER.matcher(text.toLowerCase(Locale.ROOT));
        if (!matcher.find()) {
            return 0;
        }
        long value = parseLong(WHITESPACE.matcher(matcher.group(1)).replaceAll(""));
        String unit = matcher.group(2);
        if (unit != null && (unit.startsWith("тис") || unit.startsWith("тыс"))) {
            value *= 1000;
        }
        return clampToInt(value);
    }

    public static int parsePrice(String text) {
        if (text == null || text.isBlank() || "0".equals(text.trim())) {
            return 0;
        }
        String compact = WHITESPACE.matcher(text.trim()).replaceAll("");
        Matcher matcher = DIGITS.matcher(compact);
        if (!matcher.find()) {
            return 0;
        }
        long amount = parseLong(matcher.group(1));
        if (amount < 0) {
            return 0;
        }
        if (compact.contains("€")) {
            return clampToInt((long) (amount * EUR_TO_USD));
        }
        if (compact.toLowerCase(Locale.ROOT).contains("грн")) {
            return clampToInt((long) (amount / UAH_PER_USD));
        }
        return clampToInt(amount);
    }

    public static String parsePhone(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String digits = NON_DIGITS.matcher(text).replaceAll("");
        if (digits.isEmpty()) {
            return "";
        }
        if (digits.startsWith("380") && digits.length() == 11) {
            return "+" + digits;
        }
        if (digits.startsWith("80") && digits.length() == 10) {
            return "+3" + digits;
        }
        if (digits.startsWith("0") && digits.length() == 9) {
            return "+38" + digits;
        }
        String tail = digits.length() > 9 ? digits.substring(digits.length() - 9) : digits;
        return "+380" + tail;
    }

    // Runs longer than a long are treated as unreadable.
    private static long parseLong(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static int clampToInt(long value) {
        if (value < 0 || value > Integer.MAX_VALUE) {
            return 0;
        }
        return (int) value;
    }
}
