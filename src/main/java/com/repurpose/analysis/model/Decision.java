package com.repurpose.analysis.model;

import java.util.List;

/**
 * Verdict plus the reasoning, risks and follow-up actions that justify it.
 *
 * @param reasoning ordered, one line per scored category
 * @param nextSteps ordered action template selected by the verdict
 */
public record Decision(Verdict verdict,
                       String confidenceLabel,
                       String recommendation,
                       List<String> reasoning,
                       List<RiskFactor> riskFactors,
                       List<String> nextSteps) {
    public Decision {
        reasoning = List.copyOf(reasoning);
        riskFactors = List.copyOf(riskFactors);
        nextSteps = List.copyOf(nextSteps);
    }
}
