package com.attorneyroster.scrape.model;

public enum ScrapeRunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
