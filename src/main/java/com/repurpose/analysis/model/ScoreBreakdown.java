package com.repurpose.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-category scores (0-100), the weights applied to them, the weighted overall score and the
 * data-completeness confidence in [0,1].
 */
public final class ScoreBreakdown {
    private final Map<CollectorId, Integer> categoryScores;
    private final Map<CollectorId, Integer> weights;
    private final int overallScore;
    private final double confidence;

    public ScoreBreakdown(Map<CollectorId, Integer> categoryScores, Map<CollectorId, Integer> weights, int overallScore, double confidence) {
        this.categoryScores = Collections.unmodifiableMap(copyOf(categoryScores));
        this.weights = Collections.unmodifiableMap(copyOf(weights));
        this.overallScore = overallScore;
        this.confidence = confidence;
    }

    /** Score of one category, or {@code null} when the category was not part of the run. */
    public Integer scoreOf(CollectorId id) { return categoryScores.get(id); }

    @JsonIgnore
    public Map<CollectorId, Integer> getCategoryScores() { return categoryScores; }

    @JsonIgnore
    public Map<CollectorId, Integer> getWeights() { return weights; }

    public int getOverallScore() { return overallScore; }
    public double getConfidence() { return confidence; }

    /** Category scores keyed by category name for JSON output. */
    public Map<String, Integer> getScoreBreakdown() { return byCategory(categoryScores); }

    /** Applied weights keyed by category name for JSON output. */
    public Map<String, Integer> getScoringWeights() { return byCategory(weights); }

    private static EnumMap<CollectorId, Integer> copyOf(Map<CollectorId, Integer> in) {
        EnumMap<CollectorId, Integer> out = new EnumMap<>(CollectorId.class);
        out.putAll(in);
        return out;
    }

    private static Map<String, Integer> byCategory(Map<CollectorId, Integer> in) {
        Map<String, Integer> out = new LinkedHashMap<>();
        in.forEach((id, v) -> out.put(id.getCategory(), v));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreBreakdown other)) return false;
        return overallScore == other.overallScore
                && Double.compare(confidence, other.confidence) == 0
                && categoryScores.equals(other.categoryScores)
                && weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        int h = categoryScores.hashCode();
        h = 31 * h + weights.hashCode();
        h = 31 * h + overallScore;
        return 31 * h + Double.hashCode(confidence);
    }

    @Override
    public String toString() {
        return "ScoreBreakdown{overall=" + overallScore + ", confidence=" + confidence + ", scores=" + categoryScores + "}";
    }
}
