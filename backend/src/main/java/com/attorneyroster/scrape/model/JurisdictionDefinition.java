package com.attorneyroster.scrape.model;

import java.util.List;

public record JurisdictionDefinition(
    String code,
    String name,
    String baseUrl,
    String searchUrl,
    FetchMethod searchMethod,
    List<SearchContext> seeds,
    List<String> knownCities,
    int barNumberDigits
) {
    public JurisdictionDefinition {
        seeds = List.copyOf(seeds);
        knownCities = List.copyOf(knownCities);
    }
}
