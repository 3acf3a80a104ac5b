package com.attorneyroster.scrape.api;

import com.attorneyroster.scrape.model.AttorneySearchCriteria;
import com.attorneyroster.scrape.model.AttorneyView;
import com.attorneyroster.scrape.model.RosterStats;
import com.attorneyroster.scrape.service.AttorneyCsvExporter;
import com.attorneyroster.scrape.service.RosterQueryService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.StringWriter;
import java.util.List;

@RestController
@RequestMapping("/api/attorneys")
public class AttorneyController {
    private static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final RosterQueryService queryService;
    private final AttorneyCsvExporter csvExporter;

    public AttorneyController(RosterQueryService queryService, AttorneyCsvExporter csvExporter) {
        this.queryService = queryService;
        this.csvExporter = csvExporter;
    }

    @GetMapping
    public List<AttorneyView> search(
        @RequestParam(name = "jurisdiction", required = false) String jurisdiction,
        @RequestParam(name = "name", required = false) String name,
        @RequestParam(name = "city", required = false) String city,
        @RequestParam(name = "firm", required = false) String firm,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "practiceArea", required = false) String practiceArea,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return queryService.searchAttorneys(jurisdiction, name, city, firm, status, practiceArea, limit);
    }

    @GetMapping("/stats")
    public RosterStats stats() {
        return queryService.getStats();
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(
        @RequestParam(name = "jurisdiction", required = false) String jurisdiction,
        @RequestParam(name = "name", required = false) String name,
        @RequestParam(name = "city", required = false) String city,
        @RequestParam(name = "firm", required = false) String firm,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "practiceArea", required = false) String practiceArea
    ) {
        List<AttorneyView> attorneys = queryService.exportAttorneys(
            new AttorneySearchCriteria(jurisdiction, name, city, firm, status, practiceArea, 0)
        );
        StringWriter out = new StringWriter();
        csvExporter.write(attorneys, out);
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"attorneys_export.csv\"")
            .contentType(TEXT_CSV)
            .body(out.toString());
    }

    @GetMapping("/{id}")
    public AttorneyView getAttorney(@PathVariable("id") long attorneyId) {
        return queryService.getAttorney(attorneyId);
    }
}
