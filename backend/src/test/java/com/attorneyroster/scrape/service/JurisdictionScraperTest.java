package com.attorneyroster.scrape.service;

import com.attorneyroster.scrape.TestJurisdictions;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import com.attorneyroster.scrape.model.JurisdictionScrapeSummary;
import com.attorneyroster.scrape.model.ScrapeRunContext;
import com.attorneyroster.scrape.model.ScrapeRunStatus;
import com.attorneyroster.scrape.model.ScrapeRunUpdate;
import com.attorneyroster.scrape.model.SearchContext;
import com.attorneyroster.scrape.model.TraversalResult;
import com.attorneyroster.scrape.model.TraversalState;
import com.attorneyroster.scrape.persistence.ScrapeRunTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JurisdictionScraperTest {
    @Mock
    private JurisdictionRegistry registry;

    @Mock
    private PaginationTraversal traversal;

    @Mock
    private ScrapeRunTracker tracker;

    private ExecutorService scrapeExecutor;
    private ExecutorService scrapeRunExecutor;
    private JurisdictionScraper scraper;

    @BeforeEach
    void setUp() {
        scrapeExecutor = Executors.newFixedThreadPool(2);
        scrapeRunExecutor = Executors.newSingleThreadExecutor();
        scraper = new JurisdictionScraper(registry, traversal, tracker, scrapeExecutor, scrapeRunExecutor);
    }

    @AfterEach
    void tearDown() {
        scrapeExecutor.shutdownNow();
        scrapeRunExecutor.shutdownNow();
    }

    @Test
    void failingContextDoesNotAbortTheOtherContexts() {
        SearchContext houston = TestJurisdictions.citySeed("Houston");
        SearchContext dallas = TestJurisdictions.citySeed("Dallas");
        JurisdictionDefinition texas = TestJurisdictions.texas("https://www.texasbar.com/search", List.of(houston, dallas));
        when(registry.definition("TX")).thenReturn(texas);
        when(tracker.begin("TX")).thenReturn(5L);
        when(traversal.traverse(eq(houston), eq(texas), any())).thenThrow(new IllegalStateException("parser blew up"));
        when(traversal.traverse(eq(dallas), eq(texas), any()))
            .thenReturn(new TraversalResult(dallas, TraversalState.DONE, 2, 4, 3, 1, 0, null));

        JurisdictionScrapeSummary summary = scraper.scrape("TX");

        assertEquals(5L, summary.runId());
        assertEquals(ScrapeRunStatus.COMPLETED, summary.status());
        assertEquals(2, summary.contextsAttempted());
        assertEquals(1, summary.contextsFailed());
        assertEquals(1, summary.errors());
        assertEquals(TraversalState.FAILED, summary.contexts().get(0).state());
        assertEquals("exception=IllegalStateException", summary.contexts().get(0).failureReason());
        assertEquals(TraversalState.DONE, summary.contexts().get(1).state());

        ArgumentCaptor<ScrapeRunUpdate> updates = ArgumentCaptor.forClass(ScrapeRunUpdate.class);
        verify(tracker, times(3)).update(eq(5L), updates.capture());
        ScrapeRunUpdate finish = updates.getAllValues().get(2);
        assertEquals(ScrapeRunStatus.COMPLETED, finish.status());
        assertEquals("contexts=2 failed=1", finish.notes());
        assertThat(finish.completedAt()).isNotNull();
        assertThat(scraper.activeRunIds()).isEmpty();
    }

    @Test
    void unknownJurisdictionFailsBeforeARunIsRecorded() {
        when(registry.definition("ZZ")).thenThrow(new UnknownJurisdictionException("ZZ"));

        assertThrows(UnknownJurisdictionException.class, () -> scraper.scrape("ZZ"));

        verify(tracker, never()).begin(anyString());
    }

    @Test
    void cancelledRunIsClosedAsFailed() {
        SearchContext austin = TestJurisdictions.citySeed("Austin");
        JurisdictionDefinition texas = TestJurisdictions.texas("https://www.texasbar.com/search", List.of(austin));
        when(registry.definition("TX")).thenReturn(texas);
        when(tracker.begin("TX")).thenReturn(6L);
        when(traversal.traverse(eq(austin), eq(texas), any())).thenAnswer(invocation -> {
            assertTrue(scraper.cancel(6L));
            ScrapeRunContext run = invocation.getArgument(2);
            assertTrue(run.isCancelled());
            return new TraversalResult(austin, TraversalState.CANCELLED, 1, 0, 0, 0, 0, null);
        });

        JurisdictionScrapeSummary summary = scraper.scrape("TX");

        assertEquals(ScrapeRunStatus.FAILED, summary.status());
        verify(tracker).update(eq(6L), argThat(update ->
            update.status() == ScrapeRunStatus.FAILED && JurisdictionScraper.CANCELLED_NOTE.equals(update.notes())
        ));
        assertEquals(false, scraper.cancel(6L));
    }

    @Test
    void secondRunOfAnActiveJurisdictionIsRejected() throws Exception {
        SearchContext austin = TestJurisdictions.citySeed("Austin");
        JurisdictionDefinition texas = TestJurisdictions.texas("https://www.texasbar.com/search", List.of(austin));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(registry.definition("TX")).thenReturn(texas);
        when(tracker.begin("TX")).thenReturn(8L);
        when(traversal.traverse(eq(austin), eq(texas), any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new TraversalResult(austin, TraversalState.DONE, 1, 0, 0, 0, 0, null);
        });

        long runId = scraper.startAsync("TX");
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertEquals(8L, runId);
        assertThat(scraper.activeRunIds()).containsExactly(8L);
        assertThrows(ActiveScrapeRunException.class, () -> scraper.scrape("TX"));

        release.countDown();
        verify(tracker, timeout(5000)).update(eq(8L), argThat(update -> update.status() == ScrapeRunStatus.COMPLETED));
        verify(tracker, times(1)).begin("TX");
        verify(tracker, atLeastOnce()).update(eq(8L), any());
    }
}
