package com.attorneyroster.scrape.model;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-scoped counters and cancellation flag shared by every worker of one jurisdiction run.
 */
public class ScrapeRunContext {
    private final long runId;
    private final String jurisdiction;
    private final AtomicInteger found = new AtomicInteger();
    private final AtomicInteger added = new AtomicInteger();
    private final AtomicInteger updated = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ScrapeRunContext(long runId, String jurisdiction) {
        this.runId = runId;
        this.jurisdiction = jurisdiction;
    }

    public long runId() {
        return runId;
    }

    public String jurisdiction() {
        return jurisdiction;
    }

    public int recordStored(UpsertOutcome outcome) {
        if (outcome == UpsertOutcome.INSERTED) {
            added.incrementAndGet();
        } else if (outcome == UpsertOutcome.UPDATED) {
            updated.incrementAndGet();
        }
        return found.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public int found() {
        return found.get();
    }

    public int added() {
        return added.get();
    }

    public int updated() {
        return updated.get();
    }

    public int errors() {
        return errors.get();
    }

    public ScrapeRunUpdate progressUpdate() {
        return ScrapeRunUpdate.progress(found(), added(), updated(), errors());
    }
}
