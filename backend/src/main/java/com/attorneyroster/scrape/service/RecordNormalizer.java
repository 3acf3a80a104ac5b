package com.attorneyroster.scrape.service;

import com.attorneyroster.scrape.model.AttorneyRecord;
import com.attorneyroster.scrape.model.CandidateField;
import com.attorneyroster.scrape.model.CandidateRecord;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import com.attorneyroster.scrape.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class RecordNormalizer {

    public AttorneyRecord normalize(CandidateRecord candidate, JurisdictionDefinition jurisdiction) {
        String fullName = field(candidate, CandidateField.FULL_NAME);
        String[] names = splitName(fullName);
        return new AttorneyRecord(
            jurisdiction.code(),
            field(candidate, CandidateField.BAR_NUMBER),
            names[0],
            names[1],
            fullName,
            field(candidate, CandidateField.STATUS),
            field(candidate, CandidateField.ADMISSION_DATE),
            field(candidate, CandidateField.FIRM_NAME),
            normalizeCity(field(candidate, CandidateField.CITY), jurisdiction.knownCities()),
            field(candidate, CandidateField.COUNTY),
            field(candidate, CandidateField.ADDRESS),
            field(candidate, CandidateField.PHONE),
            field(candidate, CandidateField.EMAIL),
            field(candidate, CandidateField.WEBSITE),
            field(candidate, CandidateField.LAW_SCHOOL),
            field(candidate, CandidateField.GRADUATION_YEAR),
            normalizePracticeAreas(candidate.practiceAreas())
        );
    }

    /**
     * First token is the first name, everything after it the last name. Multi-word first names
     * ("Mary Ann Smith") end up in the last name.
     */
    static String[] splitName(String fullName) {
        if (fullName == null) {
            return new String[]{null, null};
        }
        if (fullName.isEmpty()) {
            return new String[]{"", ""};
        }
        int space = fullName.indexOf(' ');
        if (space < 0) {
            return new String[]{"", fullName};
        }
        return new String[]{fullName.substring(0, space), fullName.substring(space + 1)};
    }

    /**
     * Allowlisted cities take the allowlist's spelling, so "SAN ANTONIO" and "mckinney" become
     * "San Antonio" and "McKinney".
     */
    static String normalizeCity(String city, List<String> knownCities) {
        if (city == null || city.isEmpty()) {
            return city;
        }
        for (String known : knownCities) {
            if (known.equalsIgnoreCase(city)) {
                return known;
            }
        }
        return city;
    }

    static List<String> normalizePracticeAreas(List<String> practiceAreas) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String raw : practiceAreas) {
            String area = TextUtils.clean(raw);
            if (area == null || area.isEmpty()) {
                continue;
            }
            if (seen.add(area.toLowerCase(Locale.ROOT))) {
                out.add(area);
            }
        }
        return out;
    }

    private String field(CandidateRecord candidate, CandidateField field) {
        return TextUtils.clean(candidate.getOrNull(field));
    }
}
