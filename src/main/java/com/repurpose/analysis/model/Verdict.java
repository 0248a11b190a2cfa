package com.repurpose.analysis.model;

/**
 * Final recommendation, ordered from most to least favourable.
 */
public enum Verdict {
    GO(70),
    CONSIDER(50),
    NO_GO(0);

    private final int minScore;

    Verdict(int minScore) {
        this.minScore = minScore;
    }

    /** Inclusive lower bound of the overall score for this verdict. */
    public int getMinScore() { return minScore; }

    public static Verdict forScore(int overallScore) {
        for (Verdict v : values()) {
            if (overallScore >= v.minScore) return v;
        }
        return NO_GO;
    }
}
