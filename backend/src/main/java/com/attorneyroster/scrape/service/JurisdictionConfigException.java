package com.attorneyroster.scrape.service;

/**
 * A jurisdiction cannot be scraped as configured. Raised before any run is recorded.
 */
public class JurisdictionConfigException extends RuntimeException {
    public JurisdictionConfigException(String message) {
        super(message);
    }
}
