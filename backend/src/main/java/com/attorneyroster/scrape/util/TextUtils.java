package com.attorneyroster.scrape.util;

import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private TextUtils() {
    }

    /**
     * Trims and collapses internal whitespace runs (non-breaking spaces included) to one space.
     * Null stays null.
     */
    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
