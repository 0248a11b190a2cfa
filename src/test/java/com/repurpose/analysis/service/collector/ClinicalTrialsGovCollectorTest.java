package com.repurpose.analysis.service.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repurpose.analysis.model.evidence.TrialsEvidence.Trial;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClinicalTrialsGovCollectorTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private static String study(String nct, String title, String status, String phase) {
        return """
                {"protocolSection": {
                   "identificationModule": {"nctId": "%s", "briefTitle": "%s"},
                   "statusModule": {"overallStatus": "%s", "enrollmentInfo": {"count": 120},
                                    "completionDateStruct": {"date": "2025-06"}},
                   "designModule": {"phases": ["%s"]}
                }}
                """.formatted(nct, title, status, phase);
    }

    @Test
    public void extractsTrialFields() throws Exception {
        JsonNode node = mapper.readTree(study("NCT01234567", "Metformin in PCOS", "RECRUITING", "PHASE2"));
        Trial t = ClinicalTrialsGovCollector.extractTrial(node);

        assertEquals("NCT01234567", t.getId());
        assertEquals("Metformin in PCOS", t.getTitle());
        assertEquals("RECRUITING", t.getStatus());
        assertEquals("PHASE2", t.getPhase());
        assertEquals(120, t.getParticipants());
        assertEquals("2025-06", t.getCompletionDate());
        assertEquals("https://clinicaltrials.gov/ct2/show/NCT01234567", t.getUrl());
    }

    @Test
    public void officialTitleWinsAndMissingFieldsGetDefaults() throws Exception {
        JsonNode node = mapper.readTree("""
                {"protocolSection": {"identificationModule": {"nctId": "NCT1", "officialTitle": "Official", "briefTitle": "Brief"}}}
                """);
        Trial t = ClinicalTrialsGovCollector.extractTrial(node);

        assertEquals("Official", t.getTitle());
        assertEquals("Unknown", t.getStatus());
        assertEquals("N/A", t.getPhase());
        assertEquals(0, t.getParticipants());
    }

    @Test
    public void keepsAtMostEightStudies() throws Exception {
        StringBuilder sb = new StringBuilder("{\"studies\": [");
        for (int i = 0; i < 10; i++) {
            if (i > 0) sb.append(',');
            sb.append(study("NCT" + i, "t" + i, "COMPLETED", "PHASE3"));
        }
        sb.append("]}");
        List<Trial> trials = ClinicalTrialsGovCollector.parseStudies(mapper.readTree(sb.toString()));
        assertEquals(8, trials.size());
        assertEquals("NCT0", trials.get(0).getId());
    }

    @Test
    public void missingStudiesArrayIsEmpty() throws Exception {
        assertTrue(ClinicalTrialsGovCollector.parseStudies(mapper.readTree("{}")).isEmpty());
    }
}
