package com.attorneyroster.scrape.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unvalidated output of one result block. Field values are raw page text; a field that was
 * never located is absent rather than empty.
 */
public final class CandidateRecord {
    private final Map<CandidateField, String> fields;
    private final List<String> practiceAreas;

    private CandidateRecord(Map<CandidateField, String> fields, List<String> practiceAreas) {
        this.fields = Collections.unmodifiableMap(new EnumMap<>(fields));
        this.practiceAreas = List.copyOf(practiceAreas);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(CandidateField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public String getOrNull(CandidateField field) {
        return fields.get(field);
    }

    public Map<CandidateField, String> fields() {
        return fields;
    }

    public List<String> practiceAreas() {
        return practiceAreas;
    }

    @Override
    public String toString() {
        return "CandidateRecord" + fields + " practiceAreas=" + practiceAreas;
    }

    public static final class Builder {
        private final Map<CandidateField, String> fields = new EnumMap<>(CandidateField.class);
        private final List<String> practiceAreas = new ArrayList<>();

        private Builder() {
        }

        public Builder with(CandidateField field, String value) {
            if (value != null) {
                fields.put(field, value);
            }
            return this;
        }

        public Builder withIfAbsent(CandidateField field, String value) {
            if (value != null) {
                fields.putIfAbsent(field, value);
            }
            return this;
        }

        public boolean has(CandidateField field) {
            return fields.containsKey(field);
        }

        public Builder addPracticeArea(String area) {
            if (area != null) {
                practiceAreas.add(area);
            }
            return this;
        }

        public CandidateRecord build() {
            return new CandidateRecord(fields, practiceAreas);
        }
    }
}
