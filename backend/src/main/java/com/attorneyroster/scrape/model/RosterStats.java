package com.attorneyroster.scrape.model;

import java.util.Map;

public record RosterStats(
    long totalAttorneys,
    Map<String, Long> byJurisdiction,
    Map<String, Long> byStatus,
    Map<String, Long> topPracticeAreas,
    Map<String, Long> topFirms
) {
}
