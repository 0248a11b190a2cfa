package com.repurpose.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Case-specific findings drawn from the reference dataset, complementing the scored evidence.
 * Only the fields relevant to the analysed case are populated.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record CaseInsights(CaseType caseType,
                           ReferenceRecord subjectRecord,
                           List<String> currentIndications,
                           List<Suggestion> potentialIndications,
                           List<Suggestion> drugCandidates,
                           IngredientProfile ingredientProfile,
                           Boolean alreadyDocumented,
                           List<String> highlights) {

    /** A suggested indication or drug with a 0-100 confidence and the reason it was suggested. */
    public record Suggestion(String name, int confidence, String rationale) {}

    public record IngredientProfile(String ingredientClass, String mechanism, List<String> properties) {}
}
