package com.attorneyroster.scrape.model;

public enum TraversalState {
    FETCHING,
    PARSING,
    FOLLOWING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
