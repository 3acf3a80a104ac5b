package com.attorneyroster.scrape.model;

public record AttorneySearchCriteria(
    String jurisdiction,
    String name,
    String city,
    String firm,
    String status,
    String practiceArea,
    int limit
) {
}
