package com.repurpose.analysis.model;

/**
 * Which part of the (subject, condition) pair was supplied for an analysis.
 * Decided once per request by {@link com.repurpose.analysis.service.CaseRouter}.
 */
public enum CaseType {
    SUBJECT_ONLY,
    CONDITION_ONLY,
    SUBJECT_AND_CONDITION,
    INGREDIENT_MODE
}
