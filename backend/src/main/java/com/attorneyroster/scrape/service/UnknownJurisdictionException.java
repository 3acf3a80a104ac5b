package com.attorneyroster.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownJurisdictionException extends JurisdictionConfigException {
    private final String code;

    public UnknownJurisdictionException(String code) {
        super("Unknown jurisdiction: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
