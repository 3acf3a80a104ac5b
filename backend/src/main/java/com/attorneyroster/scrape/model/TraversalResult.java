package com.attorneyroster.scrape.model;

public record TraversalResult(
    SearchContext context,
    TraversalState state,
    int pagesFetched,
    int found,
    int added,
    int updated,
    int errors,
    String failureReason
) {
}
