package com.attorneyroster.scrape.service;

import com.attorneyroster.config.RosterProperties;
import com.attorneyroster.scrape.model.ScrapeRunStatus;
import com.attorneyroster.scrape.model.ScrapeRunUpdate;
import com.attorneyroster.scrape.model.ScrapeRunView;
import com.attorneyroster.scrape.persistence.ScrapeRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Closes runs that a previous process left in RUNNING. Ordered ahead of {@link ScrapeCliRunner}.
 */
@Component
@Order(0)
public class ScrapeRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunLifecycleRunner.class);

    private final ScrapeRunJdbcRepository repository;
    private final JurisdictionScraper scraper;
    private final RosterProperties properties;

    public ScrapeRunLifecycleRunner(
        ScrapeRunJdbcRepository repository,
        JurisdictionScraper scraper,
        RosterProperties properties
    ) {
        this.repository = repository;
        this.scraper = scraper;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape run cleanup because database is unreachable");
            return;
        }

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        for (ScrapeRunView run : repository.findRunningRuns()) {
            if (scraper.activeRunIds().contains(run.runId())) {
                continue;
            }
            if (run.startedAt() != null && run.startedAt().isAfter(cutoff)) {
                continue;
            }
            repository.update(
                run.runId(),
                new ScrapeRunUpdate(null, null, null, null, ScrapeRunStatus.FAILED, "aborted_on_startup", Instant.now())
            );
            log.info("Closed stale scrape run {} for {} startedAt={}", run.runId(), run.jurisdiction(), run.startedAt());
        }
    }
}
