package com.attorneyroster.scrape.model;

public record RawPage(
    SearchContext context,
    String locator,
    String finalUrl,
    String html
) {
}
