package com.repurpose.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Locale;

/**
 * Canonical reference-dataset view of one drug, aggregated over every matching dataset row.
 * An unmatched lookup yields {@link #empty(String)} rather than an error.
 */
public record ReferenceRecord(String name,
                              List<String> categories,
                              List<String> dosageForms,
                              List<String> strengths,
                              List<String> indications,
                              List<String> manufacturers,
                              List<String> classifications,
                              int recordCount) {

    public ReferenceRecord {
        categories = List.copyOf(categories);
        dosageForms = List.copyOf(dosageForms);
        strengths = List.copyOf(strengths);
        indications = List.copyOf(indications);
        manufacturers = List.copyOf(manufacturers);
        classifications = List.copyOf(classifications);
    }

    public static ReferenceRecord empty(String name) {
        return new ReferenceRecord(name, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), 0);
    }

    @JsonIgnore
    public boolean isEmpty() { return recordCount == 0; }

    /** Primary category, or an empty string when unknown. */
    @JsonIgnore
    public String primaryCategory() { return categories.isEmpty() ? "" : categories.get(0); }

    /** Prescription or over-the-counter classification implies a marketed, approved product. */
    public boolean marketedApproved() {
        return classifications.stream().anyMatch(c -> {
            String lc = c.toLowerCase(Locale.ROOT);
            return lc.contains("prescription") || lc.contains("over-the-counter") || lc.equals("otc");
        });
    }

    public boolean documentsIndication(String condition) {
        if (condition == null || condition.isBlank()) return false;
        String needle = condition.trim().toLowerCase(Locale.ROOT);
        return indications.stream().anyMatch(i -> i.toLowerCase(Locale.ROOT).contains(needle) || needle.contains(i.toLowerCase(Locale.ROOT)));
    }
}
