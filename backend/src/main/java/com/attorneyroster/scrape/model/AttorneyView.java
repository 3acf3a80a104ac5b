package com.attorneyroster.scrape.model;

import java.time.Instant;
import java.util.List;

public record AttorneyView(
    long id,
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
    List<String> practiceAreas,
    Instant createdAt,
    Instant updatedAt
) {
}
