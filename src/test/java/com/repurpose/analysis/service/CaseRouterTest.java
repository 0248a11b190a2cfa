package com.repurpose.analysis.service;

import com.repurpose.analysis.model.CaseType;
import com.repurpose.analysis.model.CollectorId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CaseRouterTest {
    private final CaseRouter router = new CaseRouter();

    @Test
    public void bothInputsRequireAllFiveCollectors() {
        CaseRouter.Routing r = router.classify("metformin", "PCOS", false);
        assertEquals(CaseType.SUBJECT_AND_CONDITION, r.caseType());
        assertEquals(List.of(CollectorId.LITERATURE, CollectorId.TRIALS, CollectorId.PATENTS,
                CollectorId.REGULATORY, CollectorId.MARKET), r.required());
    }

    @Test
    public void subjectOnlySkipsConditionBoundCollectors() {
        CaseRouter.Routing r = router.classify("metformin", null, false);
        assertEquals(CaseType.SUBJECT_ONLY, r.caseType());
        assertEquals(List.of(CollectorId.LITERATURE, CollectorId.REGULATORY), r.required());
    }

    @Test
    public void conditionOnly() {
        CaseRouter.Routing r = router.classify("   ", "PCOS", false);
        assertEquals(CaseType.CONDITION_ONLY, r.caseType());
        assertEquals(List.of(CollectorId.LITERATURE, CollectorId.REGULATORY), r.required());
    }

    @Test
    public void ingredientModeWinsWhenSubjectPresent() {
        CaseRouter.Routing r = router.classify("metformin", "PCOS", true);
        assertEquals(CaseType.INGREDIENT_MODE, r.caseType());
        assertTrue(r.required().containsAll(List.of(CollectorId.LITERATURE, CollectorId.REGULATORY)));
    }

    @Test
    public void ingredientModeWithoutSubjectFallsThrough() {
        CaseRouter.Routing r = router.classify(null, "PCOS", true);
        assertEquals(CaseType.CONDITION_ONLY, r.caseType());
    }

    @Test
    public void neitherInputIsSubjectOnly() {
        CaseRouter.Routing r = router.classify(null, "", false);
        assertEquals(CaseType.SUBJECT_ONLY, r.caseType());
        assertFalse(r.required().isEmpty());
    }
}
