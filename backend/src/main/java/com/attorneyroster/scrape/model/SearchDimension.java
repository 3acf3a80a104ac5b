package com.attorneyroster.scrape.model;

public enum SearchDimension {
    CITY("City"),
    LETTER("Letter");

    private final String label;

    SearchDimension(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
