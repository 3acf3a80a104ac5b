package com.attorneyroster.scrape.service;

import com.attorneyroster.config.RosterProperties;
import com.attorneyroster.scrape.model.JurisdictionScrapeSummary;
import com.attorneyroster.scrape.model.ScrapeRunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeCliRunnerTest {
    @Mock
    private JurisdictionRegistry registry;

    @Mock
    private JurisdictionScraper scraper;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    private RosterProperties properties;
    private ScrapeCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new RosterProperties();
        properties.getCli().setExitAfterRun(false);
        runner = new ScrapeCliRunner(properties, registry, scraper, applicationContext);
    }

    @Test
    void doesNothingUnlessEnabled() {
        runner.run(new DefaultApplicationArguments());

        verify(scraper, never()).scrape(anyString());
    }

    @Test
    void blankSelectionScrapesEveryConfiguredJurisdiction() {
        properties.getCli().setJurisdictions(" ");
        when(registry.codes()).thenReturn(List.of("TX", "OK"));

        assertThat(runner.selectedJurisdictions()).containsExactly("TX", "OK");
    }

    @Test
    void failingJurisdictionDoesNotStopTheNextOne() {
        properties.getCli().setRun(true);
        properties.getCli().setJurisdictions("ZZ, TX");
        when(scraper.scrape("ZZ")).thenThrow(new UnknownJurisdictionException("ZZ"));
        when(scraper.scrape("TX")).thenReturn(new JurisdictionScrapeSummary(
            4L,
            "TX",
            Instant.now(),
            Instant.now(),
            ScrapeRunStatus.COMPLETED,
            0,
            0,
            0,
            0,
            0,
            0,
            List.of()
        ));

        runner.run(new DefaultApplicationArguments());

        verify(scraper).scrape("ZZ");
        verify(scraper).scrape("TX");
        verify(registry, never()).codes();
    }
}
