package com.attorneyroster.scrape.model;

public record UpsertResult(long attorneyId, UpsertOutcome outcome) {}
