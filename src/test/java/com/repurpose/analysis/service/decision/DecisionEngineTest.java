package com.repurpose.analysis.service.decision;

import com.repurpose.analysis.EvidenceFixtures;
import com.repurpose.analysis.model.CaseType;
import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.Decision;
import com.repurpose.analysis.model.ErrorKind;
import com.repurpose.analysis.model.EvidencePool;
import com.repurpose.analysis.model.RiskFactor;
import com.repurpose.analysis.model.RunSummary;
import com.repurpose.analysis.model.ScoreBreakdown;
import com.repurpose.analysis.model.Verdict;
import com.repurpose.analysis.service.scoring.ScoringEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DecisionEngineTest {
    private final DecisionEngine engine = new DecisionEngine();
    private final ScoringEngine scoring = new ScoringEngine();

    private static RunSummary summary(CollectorId... failed) {
        List<RunSummary.CollectorOutcome> outcomes = new ArrayList<>();
        List<CollectorId> failedList = List.of(failed);
        for (CollectorId id : CollectorId.values()) {
            boolean ok = !failedList.contains(id);
            outcomes.add(new RunSummary.CollectorOutcome(id, ok, ok ? null : ErrorKind.TIMEOUT, ok ? null : "timed out", 5));
        }
        return new RunSummary(CaseType.SUBJECT_AND_CONDITION, outcomes, 10);
    }

    private static ScoreBreakdown overallOnly(int overall, double confidence) {
        Map<CollectorId, Integer> scores = new EnumMap<>(CollectorId.class);
        scores.put(CollectorId.LITERATURE, overall);
        Map<CollectorId, Integer> weights = new EnumMap<>(CollectorId.class);
        weights.put(CollectorId.LITERATURE, 100);
        return new ScoreBreakdown(scores, weights, overall, confidence);
    }

    @Test
    public void verdictThresholds() {
        EvidencePool pool = EvidenceFixtures.metforminPool();
        assertEquals(Verdict.GO, engine.decide(overallOnly(70, 1.0), pool, summary()).verdict());
        assertEquals(Verdict.CONSIDER, engine.decide(overallOnly(69, 1.0), pool, summary()).verdict());
        assertEquals(Verdict.CONSIDER, engine.decide(overallOnly(50, 1.0), pool, summary()).verdict());
        assertEquals(Verdict.NO_GO, engine.decide(overallOnly(49, 1.0), pool, summary()).verdict());
    }

    @Test
    public void metforminGoCitesAbbreviatedPathway() {
        EvidencePool pool = EvidenceFixtures.metforminPool();
        Decision d = engine.decide(scoring.score(pool), pool, summary());

        assertEquals(Verdict.GO, d.verdict());
        assertEquals("High", d.confidenceLabel());
        assertTrue(d.recommendation().startsWith("PROCEED"));
        assertEquals(5, d.reasoning().size());
        assertTrue(d.reasoning().stream().anyMatch(r -> r.contains("505(b)(2)")), d.reasoning().toString());
        assertTrue(d.reasoning().get(1).contains("2 trials"), d.reasoning().get(1));
        assertTrue(d.riskFactors().isEmpty(), d.riskFactors().toString());
        assertEquals(5, d.nextSteps().size());
        assertEquals("1. Conduct regulatory pre-IND meeting with FDA", d.nextSteps().get(0));
    }

    @Test
    public void failedTrialsProduceHighAndLowRisks() {
        EvidencePool pool = EvidenceFixtures.metforminPoolWithout(CollectorId.TRIALS);
        Decision d = engine.decide(scoring.score(pool), pool, summary(CollectorId.TRIALS));

        assertEquals(Verdict.CONSIDER, d.verdict());
        assertEquals("Low", d.confidenceLabel());
        assertTrue(d.riskFactors().contains(new RiskFactor("No or limited clinical trial data", RiskFactor.HIGH, "Plan Phase II proof-of-concept trial")));
        assertTrue(d.riskFactors().contains(new RiskFactor("Low data completeness", RiskFactor.MODERATE, "Gather additional evidence")));
        assertTrue(d.riskFactors().contains(new RiskFactor("TrialsAgent could not retrieve data", RiskFactor.LOW, "Use alternative data sources")));
        assertEquals(5, d.nextSteps().size());
    }

    @Test
    public void reasoningOnlyCoversScoredCategories() {
        Map<CollectorId, Integer> scores = new EnumMap<>(CollectorId.class);
        scores.put(CollectorId.LITERATURE, 30);
        scores.put(CollectorId.REGULATORY, 45);
        ScoreBreakdown s = new ScoreBreakdown(scores, ScoringEngine.weightsFor(scores.keySet()), 37, 1.0);
        Decision d = engine.decide(s, EvidenceFixtures.metforminPool(), new RunSummary(CaseType.SUBJECT_ONLY, List.of(), 0));

        assertEquals(2, d.reasoning().size());
        assertEquals(Verdict.NO_GO, d.verdict());
        assertEquals(4, d.nextSteps().size());
        assertEquals(List.of(
                new RiskFactor("Insufficient research evidence", RiskFactor.HIGH, "Conduct comprehensive literature review"),
                new RiskFactor("Unclear regulatory pathway", RiskFactor.MODERATE, "Consult with FDA for guidance")), d.riskFactors());
    }

    @Test
    public void confidenceLabels() {
        assertEquals("High", DecisionEngine.confidenceLabel(0.8));
        assertEquals("Moderate", DecisionEngine.confidenceLabel(0.6));
        assertEquals("Low", DecisionEngine.confidenceLabel(0.56));
    }

    @Test
    public void decisionIsDeterministic() {
        EvidencePool pool = EvidenceFixtures.metforminPool();
        ScoreBreakdown s = scoring.score(pool);
        assertEquals(engine.decide(s, pool, summary()), engine.decide(s, pool, summary()));
    }
}
