package com.attorneyroster.scrape.model;

import java.util.Locale;

public enum FetchMethod {
    GET,
    POST;

    public static FetchMethod parse(String value) {
        if (value == null || value.isBlank()) {
            return POST;
        }
        return FetchMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
