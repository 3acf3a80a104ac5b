package com.attorneyroster.scrape.model;

public enum CandidateField {
    FULL_NAME,
    BAR_NUMBER,
    CITY,
    FIRM_NAME,
    STATUS,
    ADMISSION_DATE,
    ADDRESS,
    COUNTY,
    PHONE,
    EMAIL,
    WEBSITE,
    LAW_SCHOOL,
    GRADUATION_YEAR
}
