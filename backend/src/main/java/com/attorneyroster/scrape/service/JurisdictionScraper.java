package com.attorneyroster.scrape.service;

import com.attorneyroster.scrape.model.JurisdictionDefinition;
import com.attorneyroster.scrape.model.JurisdictionScrapeSummary;
import com.attorneyroster.scrape.model.ScrapeRunContext;
import com.attorneyroster.scrape.model.ScrapeRunStatus;
import com.attorneyroster.scrape.model.ScrapeRunUpdate;
import com.attorneyroster.scrape.model.SearchContext;
import com.attorneyroster.scrape.model.TraversalResult;
import com.attorneyroster.scrape.model.TraversalState;
import com.attorneyroster.scrape.persistence.ScrapeRunTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs every seed search of one jurisdiction and records the run. Seeds go to the scrape worker
 * pool; their results are joined in seed order so progress is pushed deterministically.
 */
@Service
public class JurisdictionScraper {
    private static final Logger log = LoggerFactory.getLogger(JurisdictionScraper.class);
    static final String CANCELLED_NOTE = "cancelled";

    private final JurisdictionRegistry registry;
    private final PaginationTraversal traversal;
    private final ScrapeRunTracker tracker;
    private final ExecutorService scrapeExecutor;
    private final ExecutorService scrapeRunExecutor;
    private final Map<Long, ScrapeRunContext> activeRuns = new ConcurrentHashMap<>();

    public JurisdictionScraper(
        JurisdictionRegistry registry,
        PaginationTraversal traversal,
        ScrapeRunTracker tracker,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor
    ) {
        this.registry = registry;
        this.traversal = traversal;
        this.tracker = tracker;
        this.scrapeExecutor = scrapeExecutor;
        this.scrapeRunExecutor = scrapeRunExecutor;
    }

    public JurisdictionScrapeSummary scrape(String code) {
        JurisdictionDefinition jurisdiction = registry.definition(code);
        ScrapeRunContext run = begin(jurisdiction);
        return runWithContext(jurisdiction, run, Instant.now());
    }

    public long startAsync(String code) {
        JurisdictionDefinition jurisdiction = registry.definition(code);
        ScrapeRunContext run = begin(jurisdiction);
        Instant startedAt = Instant.now();
        try {
            scrapeRunExecutor.submit(() -> runWithContext(jurisdiction, run, startedAt));
        } catch (RuntimeException e) {
            activeRuns.remove(run.runId());
            tracker.update(
                run.runId(),
                ScrapeRunUpdate.finish(0, 0, 0, 0, ScrapeRunStatus.FAILED, "exception=" + e.getClass().getSimpleName(), Instant.now())
            );
            throw e;
        }
        return run.runId();
    }

    /**
     * Signals cancellation to a run of this process. Returns false when the run is not active here.
     */
    public boolean cancel(long runId) {
        ScrapeRunContext run = activeRuns.get(runId);
        if (run == null) {
            return false;
        }
        run.cancel();
        log.info("Cancellation requested for scrape run {} ({})", runId, run.jurisdiction());
        return true;
    }

    public Set<Long> activeRunIds() {
        return new TreeSet<>(activeRuns.keySet());
    }

    private synchronized ScrapeRunContext begin(JurisdictionDefinition jurisdiction) {
        for (ScrapeRunContext active : activeRuns.values()) {
            if (active.jurisdiction().equals(jurisdiction.code())) {
                throw new ActiveScrapeRunException(
                    "Scrape run " + active.runId() + " for " + jurisdiction.code() + " is still in progress"
                );
            }
        }
        long runId = tracker.begin(jurisdiction.code());
        ScrapeRunContext run = new ScrapeRunContext(runId, jurisdiction.code());
        activeRuns.put(runId, run);
        log.info(
            "Scrape run {} started for {} ({}) with {} seed searches",
            runId,
            jurisdiction.code(),
            jurisdiction.name(),
            jurisdiction.seeds().size()
        );
        return run;
    }

    private JurisdictionScrapeSummary runWithContext(
        JurisdictionDefinition jurisdiction,
        ScrapeRunContext run,
        Instant startedAt
    ) {
        long runId = run.runId();
        ScrapeRunStatus status = ScrapeRunStatus.FAILED;
        String notes = "scrape_failed";
        Instant completedAt = null;
        List<TraversalResult> results = new ArrayList<>();
        int contextsFailed = 0;

        try {
            List<SearchContext> seeds = jurisdiction.seeds();
            List<CompletableFuture<TraversalResult>> futures = new ArrayList<>();
            for (SearchContext seed : seeds) {
                futures.add(CompletableFuture.supplyAsync(
                    () -> traversal.traverse(seed, jurisdiction, run),
                    scrapeExecutor
                ));
            }

            for (int i = 0; i < futures.size(); i++) {
                SearchContext seed = seeds.get(i);
                TraversalResult result;
                try {
                    result = futures.get(i).join();
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    run.recordError();
                    log.warn("Search {} {} failed in scrape run {}", jurisdiction.code(), seed.label(), runId, cause);
                    result = new TraversalResult(
                        seed,
                        TraversalState.FAILED,
                        0,
                        0,
                        0,
                        0,
                        1,
                        "exception=" + cause.getClass().getSimpleName()
                    );
                }
                if (result.state() == TraversalState.FAILED) {
                    contextsFailed++;
                }
                results.add(result);
                tracker.update(runId, run.progressUpdate());
            }

            if (run.isCancelled()) {
                status = ScrapeRunStatus.FAILED;
                notes = CANCELLED_NOTE;
            } else {
                status = ScrapeRunStatus.COMPLETED;
                notes = "contexts=" + results.size() + " failed=" + contextsFailed;
            }
        } catch (Exception e) {
            log.warn("Scrape run {} for {} failed", runId, jurisdiction.code(), e);
            status = ScrapeRunStatus.FAILED;
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            completedAt = Instant.now();
            try {
                tracker.update(
                    runId,
                    ScrapeRunUpdate.finish(
                        run.found(),
                        run.added(),
                        run.updated(),
                        run.errors(),
                        status,
                        notes,
                        completedAt
                    )
                );
            } finally {
                activeRuns.remove(runId);
            }
        }

        log.info(
            "Scrape run {} for {} finished {}: found={} added={} updated={} errors={} ({})",
            runId,
            jurisdiction.code(),
            status,
            run.found(),
            run.added(),
            run.updated(),
            run.errors(),
            notes
        );
        return new JurisdictionScrapeSummary(
            runId,
            jurisdiction.code(),
            startedAt,
            completedAt,
            status,
            results.size(),
            contextsFailed,
            run.found(),
            run.added(),
            run.updated(),
            run.errors(),
            List.copyOf(results)
        );
    }
}
