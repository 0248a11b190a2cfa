package com.repurpose.analysis.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Complete outcome of one analysis, handed to the presentation layer. Always fully populated,
 * even when every collector failed.
 */
public record AnalysisResult(String drugName,
                             String targetCondition,
                             CaseType caseType,
                             int score,
                             Verdict verdict,
                             double confidence,
                             String confidenceLabel,
                             String recommendation,
                             List<String> reasoning,
                             List<RiskFactor> riskFactors,
                             List<String> nextSteps,
                             ScoreBreakdown scoreBreakdown,
                             EvidencePool evidencePool,
                             RunSummary runSummary,
                             CaseInsights insights,
                             OffsetDateTime analyzedAt) {
}
