package com.attorneyroster.scrape.service;

import com.attorneyroster.config.RosterProperties;
import com.attorneyroster.scrape.extract.ExtractionPipeline;
import com.attorneyroster.scrape.extract.NextPageLinkFinder;
import com.attorneyroster.scrape.extract.PageExtraction;
import com.attorneyroster.scrape.http.PoliteHttpClient;
import com.attorneyroster.scrape.model.AttorneyRecord;
import com.attorneyroster.scrape.model.CandidateRecord;
import com.attorneyroster.scrape.model.HttpFetchResult;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import com.attorneyroster.scrape.model.RawPage;
import com.attorneyroster.scrape.model.ScrapeRunContext;
import com.attorneyroster.scrape.model.SearchContext;
import com.attorneyroster.scrape.model.TraversalResult;
import com.attorneyroster.scrape.model.TraversalState;
import com.attorneyroster.scrape.model.UpsertOutcome;
import com.attorneyroster.scrape.model.UpsertResult;
import com.attorneyroster.scrape.persistence.PersistenceGateway;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Walks the result pages of one search context: submit the search, extract and store every
 * record on the page, follow the "next" link, and stop on a missing or repeated link or at the
 * page bound. Each call owns its own visited-locator set.
 */
@Service
public class PaginationTraversal {
    private static final Logger log = LoggerFactory.getLogger(PaginationTraversal.class);

    private final PoliteHttpClient httpClient;
    private final ExtractionPipeline extractionPipeline;
    private final NextPageLinkFinder nextPageLinkFinder;
    private final RecordNormalizer normalizer;
    private final PersistenceGateway persistenceGateway;
    private final RosterProperties properties;

    public PaginationTraversal(
        PoliteHttpClient httpClient,
        ExtractionPipeline extractionPipeline,
        NextPageLinkFinder nextPageLinkFinder,
        RecordNormalizer normalizer,
        PersistenceGateway persistenceGateway,
        RosterProperties properties
    ) {
        this.httpClient = httpClient;
        this.extractionPipeline = extractionPipeline;
        this.nextPageLinkFinder = nextPageLinkFinder;
        this.normalizer = normalizer;
        this.persistenceGateway = persistenceGateway;
        this.properties = properties;
    }

    public TraversalResult traverse(SearchContext context, JurisdictionDefinition jurisdiction, ScrapeRunContext run) {
        int maxPages = properties.getPagination().getMaxPagesPerContext();
        Set<String> visited = new HashSet<>();
        TraversalState state = TraversalState.FETCHING;
        String locator = jurisdiction.searchUrl();
        boolean searchSubmission = true;
        RawPage page = null;
        Document document = null;
        int pagesFetched = 0;
        int found = 0;
        int added = 0;
        int updated = 0;
        int errors = 0;
        String failureReason = null;

        log.info("Searching {} {}", context.jurisdiction(), context.label());
        while (!state.isTerminal()) {
            switch (state) {
                case FETCHING -> {
                    if (run.isCancelled()) {
                        state = TraversalState.CANCELLED;
                        break;
                    }
                    visited.add(locator);
                    HttpFetchResult result = searchSubmission
                        ? httpClient.fetch(locator, jurisdiction.searchMethod(), context.parameters())
                        : httpClient.get(locator);
                    pagesFetched++;
                    if (!result.isSuccessful()) {
                        run.recordError();
                        errors++;
                        failureReason = result.failureSummary();
                        log.warn(
                            "Fetch failed for {} {} page {} ({}): {}",
                            context.jurisdiction(),
                            context.label(),
                            pagesFetched,
                            locator,
                            failureReason
                        );
                        state = TraversalState.FAILED;
                        break;
                    }
                    page = new RawPage(context, locator, result.finalUrlOrRequested(), result.body());
                    state = TraversalState.PARSING;
                }
                case PARSING -> {
                    document = Jsoup.parse(page.html() == null ? "" : page.html(), page.finalUrl());
                    PageExtraction extraction = extractionPipeline.extract(document, jurisdiction);
                    if (extraction.rejectedBlocks() > 0) {
                        log.debug(
                            "{} {}: {} block(s) without a name skipped on {}",
                            context.jurisdiction(),
                            context.label(),
                            extraction.rejectedBlocks(),
                            page.finalUrl()
                        );
                    }
                    state = TraversalState.FOLLOWING;
                    for (CandidateRecord candidate : extraction.candidates()) {
                        if (run.isCancelled()) {
                            state = TraversalState.CANCELLED;
                            break;
                        }
                        Optional<UpsertOutcome> outcome = store(candidate, jurisdiction, context, run);
                        if (outcome.isEmpty()) {
                            errors++;
                            continue;
                        }
                        found++;
                        if (outcome.get() == UpsertOutcome.INSERTED) {
                            added++;
                        } else {
                            updated++;
                        }
                    }
                }
                case FOLLOWING -> {
                    if (pagesFetched >= maxPages) {
                        log.info(
                            "{} {} stopped at the page limit of {}",
                            context.jurisdiction(),
                            context.label(),
                            maxPages
                        );
                        state = TraversalState.DONE;
                        break;
                    }
                    Optional<String> next = nextPageLinkFinder.find(document, jurisdiction.baseUrl());
                    if (next.isEmpty()) {
                        state = TraversalState.DONE;
                        break;
                    }
                    if (visited.contains(next.get())) {
                        log.debug("{} {}: next link {} already visited", context.jurisdiction(), context.label(), next.get());
                        state = TraversalState.DONE;
                        break;
                    }
                    if (!sleepPaginationDelay()) {
                        state = TraversalState.CANCELLED;
                        break;
                    }
                    locator = next.get();
                    searchSubmission = false;
                    state = TraversalState.FETCHING;
                }
                default -> throw new IllegalStateException("Unexpected traversal state " + state);
            }
        }

        if (state == TraversalState.CANCELLED) {
            log.info("{} {} cancelled after {} page(s)", context.jurisdiction(), context.label(), pagesFetched);
        } else {
            log.info(
                "{} {} finished {}: pages={} found={} added={} updated={} errors={}",
                context.jurisdiction(),
                context.label(),
                state,
                pagesFetched,
                found,
                added,
                updated,
                errors
            );
        }
        return new TraversalResult(context, state, pagesFetched, found, added, updated, errors, failureReason);
    }

    private Optional<UpsertOutcome> store(
        CandidateRecord candidate,
        JurisdictionDefinition jurisdiction,
        SearchContext context,
        ScrapeRunContext run
    ) {
        AttorneyRecord record = normalizer.normalize(candidate, jurisdiction);
        try {
            UpsertResult result = persistenceGateway.upsert(record);
            persistenceGateway.attachPracticeAreas(result.attorneyId(), record.practiceAreas());
            int total = run.recordStored(result.outcome());
            if (total % properties.getPagination().getProgressLogInterval() == 0) {
                log.info("{} progress: {} attorneys stored ({})", run.jurisdiction(), total, context.label());
            }
            return Optional.of(result.outcome());
        } catch (RuntimeException e) {
            run.recordError();
            log.warn(
                "Failed to store {} ({}) for {} {}",
                record.fullName(),
                record.barNumber(),
                context.jurisdiction(),
                context.label(),
                e
            );
            return Optional.empty();
        }
    }

    private boolean sleepPaginationDelay() {
        int min = properties.getPagination().getDelayMinMs();
        int max = properties.getPagination().getDelayMaxMs();
        long delay = max <= min ? min : ThreadLocalRandom.current().nextLong(min, max + 1L);
        if (delay <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
