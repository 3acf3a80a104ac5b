package com.attorneyroster.scrape.model;

import java.time.Instant;
import java.util.List;

public record JurisdictionScrapeSummary(
    long runId,
    String jurisdiction,
    Instant startedAt,
    Instant completedAt,
    ScrapeRunStatus status,
    int contextsAttempted,
    int contextsFailed,
    int found,
    int added,
    int updated,
    int errors,
    List<TraversalResult> contexts
) {
}
