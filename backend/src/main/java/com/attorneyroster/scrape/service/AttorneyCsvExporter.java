package com.attorneyroster.scrape.service;

import com.attorneyroster.scrape.model.AttorneyView;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

@Component
public class AttorneyCsvExporter {
    static final String[] HEADERS = {
        "full_name",
        "first_name",
        "last_name",
        "bar_number",
        "jurisdiction",
        "status",
        "admission_date",
        "firm_name",
        "city",
        "address",
        "phone",
        "email",
        "website",
        "law_school"
    };

    /**
     * Writes one row per attorney. Absent fields become empty cells.
     */
    public int write(List<AttorneyView> attorneys, Writer writer) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .setNullString("")
            .build();
        try {
            CSVPrinter printer = new CSVPrinter(writer, format);
            for (AttorneyView attorney : attorneys) {
                printer.printRecord(
                    attorney.fullName(),
                    attorney.firstName(),
                    attorney.lastName(),
                    attorney.barNumber(),
                    attorney.jurisdiction(),
                    attorney.status(),
                    attorney.admissionDate(),
                    attorney.firmName(),
                    attorney.city(),
                    attorney.address(),
                    attorney.phone(),
                    attorney.email(),
                    attorney.website(),
                    attorney.lawSchool()
                );
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write attorney CSV", e);
        }
        return attorneys.size();
    }
}
