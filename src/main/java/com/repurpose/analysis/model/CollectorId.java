package com.repurpose.analysis.model;

/**
 * Identifies one evidence collector and the category slot it fills in the evidence pool.
 *
 * <p>The declaration order is the canonical category order used for pools, weights and
 * reasoning output.
 */
public enum CollectorId {
    LITERATURE("literature", "ResearchAgent", true),
    TRIALS("trials", "TrialsAgent", true),
    PATENTS("patents", "PatentAgent", false),
    REGULATORY("regulatory", "RegulatoryAgent", false),
    MARKET("market", "MarketAgent", false);

    private final String category;
    private final String agentName;
    private final boolean critical;

    CollectorId(String category, String agentName, boolean critical) {
        this.category = category;
        this.agentName = agentName;
        this.critical = critical;
    }

    /** Category key as exposed in pools and score breakdowns (e.g. "literature"). */
    public String getCategory() { return category; }

    /** Human-facing collector name used in errors and risk factors (e.g. "TrialsAgent"). */
    public String getAgentName() { return agentName; }

    /** Critical collectors penalize confidence when they fail. */
    public boolean isCritical() { return critical; }

    public static CollectorId fromCategory(String category) {
        for (CollectorId id : values()) {
            if (id.category.equalsIgnoreCase(category)) return id;
        }
        throw new IllegalArgumentException("Unknown evidence category: " + category);
    }
}
