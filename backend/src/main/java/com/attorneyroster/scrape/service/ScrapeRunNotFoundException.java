package com.attorneyroster.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ScrapeRunNotFoundException extends RuntimeException {
    public ScrapeRunNotFoundException(long runId) {
        super("Scrape run not found: " + runId);
    }
}
