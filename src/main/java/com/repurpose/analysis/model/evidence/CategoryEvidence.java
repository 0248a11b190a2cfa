package com.repurpose.analysis.model.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.repurpose.analysis.model.CollectorId;

/**
 * Base type for the category-specific evidence records a collector produces.
 *
 * <p>Every variant has a neutral default (see the {@code neutral()} factory on each subclass)
 * which the orchestrator substitutes when the collector failed; such records report
 * {@link #isRetrieved()} as {@code false} so scoring can apply its failure floor.
 *
 * @see LiteratureEvidence
 * @see TrialsEvidence
 * @see PatentEvidence
 * @see RegulatoryEvidence
 * @see MarketEvidence
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class CategoryEvidence {
    private boolean retrieved = true;
    private String dataSource;

    protected CategoryEvidence() {}

    protected CategoryEvidence(boolean retrieved, String dataSource) {
        this.retrieved = retrieved;
        this.dataSource = dataSource;
    }

    /** The collector slot this record belongs to. */
    public abstract CollectorId collectorId();

    public boolean isRetrieved() { return retrieved; }
    public void setRetrieved(boolean retrieved) { this.retrieved = retrieved; }
    public String getDataSource() { return dataSource; }
    public void setDataSource(String dataSource) { this.dataSource = dataSource; }
}
