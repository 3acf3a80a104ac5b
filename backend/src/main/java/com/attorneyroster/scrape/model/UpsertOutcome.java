package com.attorneyroster.scrape.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED
}
