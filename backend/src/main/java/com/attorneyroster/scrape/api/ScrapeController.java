package com.attorneyroster.scrape.api;

import com.attorneyroster.scrape.model.JurisdictionDefinition;
import com.attorneyroster.scrape.model.JurisdictionScrapeSummary;
import com.attorneyroster.scrape.model.ScrapeRunView;
import com.attorneyroster.scrape.service.JurisdictionRegistry;
import com.attorneyroster.scrape.service.JurisdictionScraper;
import com.attorneyroster.scrape.service.RosterQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private final JurisdictionScraper scraper;
    private final JurisdictionRegistry registry;
    private final RosterQueryService queryService;

    public ScrapeController(
        JurisdictionScraper scraper,
        JurisdictionRegistry registry,
        RosterQueryService queryService
    ) {
        this.scraper = scraper;
        this.registry = registry;
        this.queryService = queryService;
    }

    @GetMapping("/jurisdictions")
    public List<Map<String, Object>> listJurisdictions() {
        return registry.definitions().stream().map(this::describe).toList();
    }

    @PostMapping("/scrape/{code}")
    public JurisdictionScrapeSummary runScrape(@PathVariable("code") String code) {
        return scraper.scrape(code);
    }

    @PostMapping("/scrape/{code}/start")
    public Map<String, Object> startScrape(@PathVariable("code") String code) {
        long runId = scraper.startAsync(code);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runId", runId);
        response.put("jurisdiction", code.trim().toUpperCase(Locale.ROOT));
        response.put("status", "RUNNING");
        return response;
    }

    @PostMapping("/scrape/runs/{id}/cancel")
    public Map<String, Object> cancelRun(@PathVariable("id") long runId) {
        if (!scraper.cancel(runId)) {
            queryService.getRun(runId);
            throw new ResponseStatusException(NOT_FOUND, "Scrape run " + runId + " is not active");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runId", runId);
        response.put("cancelRequested", true);
        return response;
    }

    @GetMapping("/scrape/runs/{id}")
    public ScrapeRunView getRun(@PathVariable("id") long runId) {
        return queryService.getRun(runId);
    }

    @GetMapping("/scrape/runs")
    public List<ScrapeRunView> getRecentRuns(@RequestParam(name = "limit", required = false) Integer limit) {
        return queryService.getRecentRuns(limit);
    }

    private Map<String, Object> describe(JurisdictionDefinition definition) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("code", definition.code());
        out.put("name", definition.name());
        out.put("searchUrl", definition.searchUrl());
        out.put("searchMethod", definition.searchMethod());
        out.put("seedCount", definition.seeds().size());
        return out;
    }
}
