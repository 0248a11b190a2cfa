package com.repurpose.analysis.service;

import com.repurpose.analysis.EvidenceFixtures;
import com.repurpose.analysis.model.CaseInsights;
import com.repurpose.analysis.model.CaseType;
import com.repurpose.analysis.service.reference.ReferenceDataset;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CaseInsightServiceTest {
    private final ReferenceDataset dataset = EvidenceFixtures.smallDataset();
    private final CaseInsightService service = new CaseInsightService(dataset);

    @Test
    public void subjectOnlySuggestsIndicationsOfSameCategoryDrugs() {
        CaseInsights i = service.insightsFor(CaseType.SUBJECT_ONLY, "metformin", "").block();

        assertNotNull(i);
        List<String> names = i.potentialIndications().stream().map(CaseInsights.Suggestion::name).toList();
        assertEquals(List.of("Obesity", "Chronic Kidney Disease"), names);
        assertTrue(i.potentialIndications().stream().allMatch(s -> s.confidence() == 75));
        assertTrue(i.currentIndications().contains("Type 2 Diabetes"));
    }

    @Test
    public void conditionOnlyListsDistinctCandidates() {
        CaseInsights i = service.insightsFor(CaseType.CONDITION_ONLY, "", "diabetes").block();

        assertNotNull(i);
        List<String> names = i.drugCandidates().stream().map(CaseInsights.Suggestion::name).toList();
        assertEquals(List.of("Metformin", "Glimepiride", "Compound RX-17"), names);
        assertEquals(90, i.drugCandidates().get(0).confidence());
    }

    @Test
    public void ingredientModeRanksAlternativeUsesByFrequency() {
        CaseInsights i = service.insightsFor(CaseType.INGREDIENT_MODE, "metformin", "").block();

        assertNotNull(i);
        assertEquals("Antidiabetic", i.ingredientProfile().ingredientClass());
        assertEquals("Regulates glucose metabolism and insulin sensitivity", i.ingredientProfile().mechanism());
        CaseInsights.Suggestion best = i.potentialIndications().get(0);
        assertEquals("Obesity", best.name());
        assertEquals(60, best.confidence());
        assertEquals("2 other Antidiabetic drugs treat this condition", best.rationale());
    }

    @Test
    public void unknownCategoryGetsGenericProfile() {
        CaseInsights.IngredientProfile p = CaseInsightService.profileFor("Immunosuppressant");
        assertEquals("Mechanism specific to Immunosuppressant class", p.mechanism());
        assertEquals(List.of("Category-specific properties"), p.properties());
    }

    @Test
    public void subjectAndConditionReportsDocumentedUse() {
        CaseInsights documented = service.insightsFor(CaseType.SUBJECT_AND_CONDITION, "metformin", "PCOS").block();
        CaseInsights novel = service.insightsFor(CaseType.SUBJECT_AND_CONDITION, "aspirin", "PCOS").block();

        assertNotNull(documented);
        assertNotNull(novel);
        assertEquals(Boolean.TRUE, documented.alreadyDocumented());
        assertEquals(Boolean.FALSE, novel.alreadyDocumented());
    }

    @Test
    public void unknownDrugIsNotAnError() {
        CaseInsights i = service.insightsFor(CaseType.SUBJECT_ONLY, "zzzzqqq", "").block();
        assertNotNull(i);
        assertTrue(i.potentialIndications().isEmpty());
        assertNull(i.subjectRecord());
    }
}
