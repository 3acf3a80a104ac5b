package com.attorneyroster.scrape.model;

import java.time.Instant;

/**
 * Partial update for a scrape run. Null components are left untouched.
 */
public record ScrapeRunUpdate(
    Integer found,
    Integer added,
    Integer updated,
    Integer errors,
    ScrapeRunStatus status,
    String notes,
    Instant completedAt
) {
    public static ScrapeRunUpdate progress(int found, int added, int updated, int errors) {
        return new ScrapeRunUpdate(found, added, updated, errors, null, null, null);
    }

    public static ScrapeRunUpdate finish(
        int found,
        int added,
        int updated,
        int errors,
        ScrapeRunStatus status,
        String notes,
        Instant completedAt
    ) {
        return new ScrapeRunUpdate(found, added, updated, errors, status, notes, completedAt);
    }

    public boolean isEmpty() {
        return found == null
            && added == null
            && updated == null
            && errors == null
            && status == null
            && notes == null
            && completedAt == null;
    }
}
