package com.attorneyroster.scrape.service;

import com.attorneyroster.config.RosterProperties;
import com.attorneyroster.scrape.model.AttorneySearchCriteria;
import com.attorneyroster.scrape.model.AttorneyView;
import com.attorneyroster.scrape.model.RosterStats;
import com.attorneyroster.scrape.model.ScrapeRunView;
import com.attorneyroster.scrape.persistence.AttorneyJdbcRepository;
import com.attorneyroster.scrape.persistence.ScrapeRunTracker;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.NOT_FOUND;

/**
 * Read-only views over stored attorneys and scrape runs. Request limits are clamped to the
 * configured API bounds.
 */
@Service
public class RosterQueryService {
    private final AttorneyJdbcRepository attorneyRepository;
    private final ScrapeRunTracker runTracker;
    private final RosterProperties properties;

    public RosterQueryService(
        AttorneyJdbcRepository attorneyRepository,
        ScrapeRunTracker runTracker,
        RosterProperties properties
    ) {
        this.attorneyRepository = attorneyRepository;
        this.runTracker = runTracker;
        this.properties = properties;
    }

    public List<AttorneyView> searchAttorneys(
        String jurisdiction,
        String name,
        String city,
        String firm,
        String status,
        String practiceArea,
        Integer limit
    ) {
        RosterProperties.Api api = properties.getApi();
        int safeLimit = limit == null ? api.getDefaultSearchLimit() : Math.max(1, Math.min(limit, api.getMaxSearchLimit()));
        return attorneyRepository.search(
            new AttorneySearchCriteria(jurisdiction, name, city, firm, status, practiceArea, safeLimit)
        );
    }

    public List<AttorneyView> exportAttorneys(AttorneySearchCriteria filters) {
        return attorneyRepository.search(new AttorneySearchCriteria(
            filters.jurisdiction(),
            filters.name(),
            filters.city(),
            filters.firm(),
            filters.status(),
            filters.practiceArea(),
            properties.getApi().getMaxExportRows()
        ));
    }

    public AttorneyView getAttorney(long attorneyId) {
        return attorneyRepository.findById(attorneyId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Attorney not found: " + attorneyId));
    }

    public RosterStats getStats() {
        return attorneyRepository.stats();
    }

    public ScrapeRunView getRun(long runId) {
        return runTracker.findRun(runId).orElseThrow(() -> new ScrapeRunNotFoundException(runId));
    }

    public List<ScrapeRunView> getRecentRuns(Integer limit) {
        int safeLimit = limit == null ? properties.getApi().getDefaultRunsLimit() : Math.max(1, Math.min(limit, 500));
        return runTracker.findRecentRuns(safeLimit);
    }
}
