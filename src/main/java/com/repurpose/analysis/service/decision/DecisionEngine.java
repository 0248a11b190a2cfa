package com.repurpose.analysis.service.decision;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.Decision;
import com.repurpose.analysis.model.EvidencePool;
import com.repurpose.analysis.model.RiskFactor;
import com.repurpose.analysis.model.RunSummary;
import com.repurpose.analysis.model.ScoreBreakdown;
import com.repurpose.analysis.model.Verdict;
import com.repurpose.analysis.model.evidence.LiteratureEvidence;
import com.repurpose.analysis.model.evidence.RegulatoryEvidence;
import com.repurpose.analysis.model.evidence.TrialsEvidence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a score breakdown into a verdict with reasoning, risk factors and next steps.
 * Pure and deterministic; only categories present in the breakdown produce reasoning or risks.
 */
@Component
public class DecisionEngine {

    static final int STRONG_TIER = 70;
    static final int MODERATE_TIER = 50;

    static final int RESEARCH_RISK_FLOOR = 40;
    static final int TRIALS_RISK_FLOOR = 40;
    static final int REGULATORY_RISK_FLOOR = 50;
    static final double CONFIDENCE_RISK_FLOOR = 0.6;

    private static final Map<Verdict, String> RECOMMENDATIONS = Map.of(
            Verdict.GO, "PROCEED with drug repurposing program - Strong scientific and commercial case",
            Verdict.CONSIDER, "CONSIDER with caution - Additional evidence and risk assessment needed",
            Verdict.NO_GO, "DO NOT PROCEED - Insufficient evidence and/or unfavorable risk-benefit profile");

    private static final Map<Verdict, List<String>> NEXT_STEPS = Map.of(
            Verdict.GO, List.of(
                    "1. Conduct regulatory pre-IND meeting with FDA",
                    "2. Design Phase II clinical trial protocol",
                    "3. Identify clinical trial sites and investigators",
                    "4. Prepare IND application",
                    "5. Launch clinical development program"),
            Verdict.CONSIDER, List.of(
                    "1. Conduct additional literature review",
                    "2. Engage clinical experts for consultation",
                    "3. Evaluate patent landscape thoroughly",
                    "4. Assess competitive landscape",
                    "5. Consider pilot/feasibility studies before full development"),
            Verdict.NO_GO, List.of(
                    "1. Identify evidence gaps that need to be addressed",
                    "2. Monitor literature for new developments",
                    "3. Consider alternative drug-condition combinations",
                    "4. Re-evaluate if new evidence emerges"));

    public Decision decide(ScoreBreakdown scores, EvidencePool pool, RunSummary summary) {
        Verdict verdict = Verdict.forScore(scores.getOverallScore());
        return new Decision(
                verdict,
                confidenceLabel(scores.getConfidence()),
                RECOMMENDATIONS.get(verdict),
                reasoning(scores, pool),
                riskFactors(scores, summary),
                NEXT_STEPS.get(verdict));
    }

    static String confidenceLabel(double confidence) {
        if (confidence >= 0.8) return "High";
        if (confidence >= 0.6) return "Moderate";
        return "Low";
    }

    static List<String> reasoning(ScoreBreakdown scores, EvidencePool pool) {
        List<String> lines = new ArrayList<>();

        Integer research = scores.scoreOf(CollectorId.LITERATURE);
        if (research != null) {
            LiteratureEvidence lit = pool.literature();
            int papers = lit == null ? 0 : lit.getTotalPapersFound();
            String text;
            if (research > STRONG_TIER) text = "Strong research evidence supporting repurposing";
            else if (research > MODERATE_TIER) text = "Moderate research evidence available";
            else text = "Limited research evidence - further studies needed";
            lines.add(text + " (" + papers + " papers, score " + research + ")");
        }

        Integer trials = scores.scoreOf(CollectorId.TRIALS);
        if (trials != null) {
            TrialsEvidence tr = pool.trials();
            int count = tr == null ? 0 : tr.getTotalTrialsFound();
            if (trials > STRONG_TIER) lines.add("Strong clinical trial support (" + count + " trials found, score " + trials + ")");
            else if (trials > MODERATE_TIER) lines.add("Some clinical trial evidence (" + count + " trials, score " + trials + ")");
            else lines.add("Limited clinical trial evidence - Phase I/II needed (score " + trials + ")");
        }

        Integer regulatory = scores.scoreOf(CollectorId.REGULATORY);
        if (regulatory != null) {
            RegulatoryEvidence reg = pool.regulatory();
            if (reg != null && reg.isAbbreviatedPathway()) {
                lines.add("FDA 505(b)(2) pathway available - expedited approval possible (score " + regulatory + ")");
            } else if (regulatory > MODERATE_TIER) {
                String pathway = reg == null ? "IND" : reg.getPathway();
                lines.add("Standard pathway required: " + pathway + " (score " + regulatory + ")");
            } else {
                lines.add("Regulatory pathway not established (score " + regulatory + ")");
            }
        }

        Integer market = scores.scoreOf(CollectorId.MARKET);
        if (market != null) {
            String text;
            if (market > STRONG_TIER) text = "Strong market opportunity and commercial viability";
            else if (market > MODERATE_TIER) text = "Moderate market opportunity";
            else text = "Limited market opportunity - niche indication";
            lines.add(text + " (score " + market + ")");
        }

        Integer patents = scores.scoreOf(CollectorId.PATENTS);
        if (patents != null) {
            String text;
            if (patents > STRONG_TIER) text = "Patent landscape favorable for protection";
            else if (patents > MODERATE_TIER) text = "Patent protection opportunities available";
            else text = "Limited patent landscape - freedom to operate to be confirmed";
            lines.add(text + " (score " + patents + ")");
        }
        return lines;
    }

    static List<RiskFactor> riskFactors(ScoreBreakdown scores, RunSummary summary) {
        List<RiskFactor> risks = new ArrayList<>();
        if (below(scores.scoreOf(CollectorId.LITERATURE), RESEARCH_RISK_FLOOR)) {
            risks.add(new RiskFactor("Insufficient research evidence", RiskFactor.HIGH, "Conduct comprehensive literature review"));
        }
        if (below(scores.scoreOf(CollectorId.TRIALS), TRIALS_RISK_FLOOR)) {
            risks.add(new RiskFactor("No or limited clinical trial data", RiskFactor.HIGH, "Plan Phase II proof-of-concept trial"));
        }
        if (below(scores.scoreOf(CollectorId.REGULATORY), REGULATORY_RISK_FLOOR)) {
            risks.add(new RiskFactor("Unclear regulatory pathway", RiskFactor.MODERATE, "Consult with FDA for guidance"));
        }
        if (scores.getConfidence() < CONFIDENCE_RISK_FLOOR) {
            risks.add(new RiskFactor("Low data completeness", RiskFactor.MODERATE, "Gather additional evidence"));
        }
        for (CollectorId failed : summary.getFailed()) {
            risks.add(new RiskFactor(failed.getAgentName() + " could not retrieve data", RiskFactor.LOW, "Use alternative data sources"));
        }
        return risks;
    }

    private static boolean below(Integer score, int floor) {
        return score != null && score < floor;
    }
}
