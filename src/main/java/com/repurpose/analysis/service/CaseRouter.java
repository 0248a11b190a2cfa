package com.repurpose.analysis.service;

import com.repurpose.analysis.model.CaseType;
import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.util.TextMatch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which case a request represents and which collectors it needs.
 */
@Component
public class CaseRouter {

    static final List<CollectorId> ALL = List.of(
            CollectorId.LITERATURE, CollectorId.TRIALS, CollectorId.PATENTS, CollectorId.REGULATORY, CollectorId.MARKET);
    static final List<CollectorId> LITERATURE_AND_REGULATORY = List.of(CollectorId.LITERATURE, CollectorId.REGULATORY);

    public record Routing(CaseType caseType, List<CollectorId> required) {
        public Routing {
            required = List.copyOf(required);
        }
    }

    /**
     * Pure and total. Either input may be {@code null} or blank, which counts as absent. With both
     * absent the request is routed as subject-only with an empty subject.
     */
    public Routing classify(String subject, String condition, boolean ingredientMode) {
        boolean hasSubject = !TextMatch.isBlank(subject);
        boolean hasCondition = !TextMatch.isBlank(condition);

        if (ingredientMode && hasSubject) {
            return new Routing(CaseType.INGREDIENT_MODE, LITERATURE_AND_REGULATORY);
        }
        if (hasSubject && hasCondition) {
            return new Routing(CaseType.SUBJECT_AND_CONDITION, ALL);
        }
        if (hasCondition) {
            return new Routing(CaseType.CONDITION_ONLY, LITERATURE_AND_REGULATORY);
        }
        return new Routing(CaseType.SUBJECT_ONLY, LITERATURE_AND_REGULATORY);
    }
}
