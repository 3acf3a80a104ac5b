package com.attorneyroster.scrape.model;

import java.time.Instant;

public record ScrapeRunView(
    long runId,
    String jurisdiction,
    Instant startedAt,
    Instant completedAt,
    int found,
    int added,
    int updated,
    int errors,
    ScrapeRunStatus status,
    String notes
) {
}
