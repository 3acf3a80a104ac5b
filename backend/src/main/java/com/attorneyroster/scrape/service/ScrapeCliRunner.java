package com.attorneyroster.scrape.service;

import com.attorneyroster.config.RosterProperties;
import com.attorneyroster.scrape.model.JurisdictionScrapeSummary;
import com.attorneyroster.scrape.model.TraversalResult;
import com.attorneyroster.scrape.model.TraversalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scrapes the jurisdictions listed in {@code roster.cli.jurisdictions} (all configured ones when
 * blank) at startup when {@code roster.cli.run=true}.
 */
@Component
@Order(1)
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final RosterProperties properties;
    private final JurisdictionRegistry registry;
    private final JurisdictionScraper scraper;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        RosterProperties properties,
        JurisdictionRegistry registry,
        JurisdictionScraper scraper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.registry = registry;
        this.scraper = scraper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        Map<String, Boolean> outcomes = new LinkedHashMap<>();
        for (String code : selectedJurisdictions()) {
            try {
                JurisdictionScrapeSummary summary = scraper.scrape(code);
                outcomes.put(summary.jurisdiction(), true);
                log.info(
                    "Scrape run {} for {} completed with status {}: contexts={} failedContexts={} found={} added={} updated={} errors={}",
                    summary.runId(),
                    summary.jurisdiction(),
                    summary.status(),
                    summary.contextsAttempted(),
                    summary.contextsFailed(),
                    summary.found(),
                    summary.added(),
                    summary.updated(),
                    summary.errors()
                );
                for (TraversalResult context : summary.contexts()) {
                    if (context.state() != TraversalState.DONE) {
                        log.info(
                            "  {} ended {} after {} page(s): {}",
                            context.context().label(),
                            context.state(),
                            context.pagesFetched(),
                            context.failureReason()
                        );
                    }
                }
            } catch (JurisdictionConfigException | ActiveScrapeRunException e) {
                outcomes.put(code, false);
                log.warn("Skipping jurisdiction {}: {}", code, e.getMessage());
            } catch (RuntimeException e) {
                outcomes.put(code, false);
                log.warn("Scrape of jurisdiction {} failed", code, e);
            }
        }
        outcomes.forEach((code, ok) -> log.info("Summary {}: {}", code, ok ? "complete" : "failed"));

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    List<String> selectedJurisdictions() {
        List<String> requested = Arrays.stream(properties.getCli().getJurisdictions().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        return requested.isEmpty() ? registry.codes() : requested;
    }
}
