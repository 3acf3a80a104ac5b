package com.attorneyroster.scrape.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SearchContext(
    String jurisdiction,
    SearchDimension dimension,
    String value,
    Map<String, String> parameters
) {
    public SearchContext {
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String label() {
        return dimension.label() + ": " + value;
    }
}
