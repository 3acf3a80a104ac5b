package com.attorneyroster.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidJurisdictionConfigException extends JurisdictionConfigException {
    public InvalidJurisdictionConfigException(String message) {
        super(message);
    }
}
