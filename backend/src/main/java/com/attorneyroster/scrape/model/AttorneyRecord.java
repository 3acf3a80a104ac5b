package com.attorneyroster.scrape.model;

import java.util.List;

public record AttorneyRecord(
    String jurisdiction,
    String barNumber,
    String firstName,
    String lastName,
    String fullName,
    String status,
    String admissionDate,
    String firmName,
    String city,
    String county,
    String address,
    String phone,
    String email,
    String website,
    String lawSchool,
    String graduationYear,
    List<String> practiceAreas
) {
    public AttorneyRecord {
        practiceAreas = practiceAreas == null ? List.of() : List.copyOf(practiceAreas);
    }

    public boolean hasBarNumber() {
        return barNumber != null && !barNumber.isBlank();
    }
}
