package com.repurpose.analysis.service.reference;

import com.repurpose.analysis.model.ReferenceRecord;

import java.util.List;

/**
 * Read-only lookup over the medicine reference dataset, injected into collectors that ground their
 * evidence in a canonical drug record. Implementations must be safe for concurrent readers.
 */
public interface ReferenceDataset {

    /**
     * Aggregated record for a drug name. Exact (case-insensitive) name matches win; otherwise
     * close spellings are accepted. No match is a normal outcome and yields an empty record.
     */
    ReferenceRecord lookup(String subjectName);

    /** Rows whose indication contains the given condition text. */
    List<MedicineRow> findByIndication(String condition, int limit);

    /** Rows whose category contains the given category text. */
    List<MedicineRow> findByCategory(String category, int limit);

    /** Distinct drug names starting with (or containing) the query, for autocomplete. */
    List<String> suggestNames(String query, int limit);

    /** Distinct indications starting with (or containing) the query, for autocomplete. */
    List<String> suggestIndications(String query, int limit);

    int size();
}
