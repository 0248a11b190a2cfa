package com.repurpose.analysis.service.reference;

import com.repurpose.analysis.model.ReferenceRecord;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvReferenceDatasetTest {
    private final CsvReferenceDataset dataset =
            new CsvReferenceDataset("classpath:data/medicine_dataset.csv", new DefaultResourceLoader());

    @Test
    public void loadsBundledDataset() {
        assertTrue(dataset.size() > 20, "size " + dataset.size());
    }

    @Test
    public void exactLookupAggregatesAllRows() {
        ReferenceRecord r = dataset.lookup("METFORMIN");

        assertEquals("Metformin", r.name());
        assertEquals(3, r.recordCount());
        assertEquals(List.of("Antidiabetic"), r.categories());
        assertEquals(List.of("Type 2 Diabetes", "Polycystic Ovary Syndrome (PCOS)"), r.indications());
        assertEquals(List.of("Tablet", "Extended-Release Tablet"), r.dosageForms());
        assertTrue(r.marketedApproved());
        assertTrue(r.documentsIndication("pcos"));
    }

    @Test
    public void closeSpellingStillMatches() {
        ReferenceRecord r = dataset.lookup("metformine");
        assertFalse(r.isEmpty());
        assertEquals("Metformin", r.name());
    }

    @Test
    public void unknownNameYieldsEmptyRecord() {
        ReferenceRecord r = dataset.lookup("unobtainium");
        assertTrue(r.isEmpty());
        assertEquals("unobtainium", r.name());
        assertTrue(r.indications().isEmpty());
    }

    @Test
    public void findsByIndicationAndCategory() {
        List<MedicineRow> hypertension = dataset.findByIndication("hypertension", 10);
        assertTrue(hypertension.stream().anyMatch(r -> r.name().equals("Amlodipine")));
        assertTrue(dataset.findByCategory("Antibiotic", 2).size() <= 2);
        assertTrue(dataset.findByIndication("", 10).isEmpty());
    }

    @Test
    public void suggestionsPreferPrefixMatches() {
        List<String> names = dataset.suggestNames("met", 5);
        assertEquals("Metformin", names.get(0));

        List<String> conditions = dataset.suggestIndications("diab", 5);
        assertTrue(conditions.contains("Type 2 Diabetes"));
    }

    @Test
    public void missingFileGivesEmptyDataset() {
        CsvReferenceDataset missing = new CsvReferenceDataset("classpath:data/does-not-exist.csv", new DefaultResourceLoader());
        assertEquals(0, missing.size());
        assertTrue(missing.lookup("metformin").isEmpty());
    }
}
