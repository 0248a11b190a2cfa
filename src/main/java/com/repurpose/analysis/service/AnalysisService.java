package com.repurpose.analysis.service;

import com.repurpose.analysis.model.AnalysisResult;
import com.repurpose.analysis.model.Decision;
import com.repurpose.analysis.model.ScoreBreakdown;
import com.repurpose.analysis.service.AnalysisOrchestrator.OrchestrationResult;
import com.repurpose.analysis.service.decision.DecisionEngine;
import com.repurpose.analysis.service.scoring.ScoringEngine;
import com.repurpose.analysis.util.TextMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

/**
 * Entry point of the pipeline: orchestrate, score, decide. Partial or total collector failure
 * still yields a complete result; the returned Mono does not error for it.
 */
@Service
public class AnalysisService {
    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisOrchestrator orchestrator;
    private final ScoringEngine scoringEngine;
    private final DecisionEngine decisionEngine;
    private final CaseInsightService caseInsightService;
    private final CaseRouter caseRouter;

    public AnalysisService(AnalysisOrchestrator orchestrator,
                           ScoringEngine scoringEngine,
                           DecisionEngine decisionEngine,
                           CaseInsightService caseInsightService,
                           CaseRouter caseRouter) {
        this.orchestrator = orchestrator;
        this.scoringEngine = scoringEngine;
        this.decisionEngine = decisionEngine;
        this.caseInsightService = caseInsightService;
        this.caseRouter = caseRouter;
    }

    public Mono<AnalysisResult> runAnalysis(String subject, String condition, boolean ingredientMode) {
        String s = subject == null ? "" : subject.trim();
        String c = condition == null ? "" : condition.trim();
        if (TextMatch.isBlank(s) && TextMatch.isBlank(c)) {
            log.warn("Analysis requested without drug or condition; running as drug-only with an empty drug name");
        }
        CaseRouter.Routing routing = caseRouter.classify(s, c, ingredientMode);

        return Mono.zip(
                        orchestrator.orchestrate(s, c, ingredientMode),
                        caseInsightService.insightsFor(routing.caseType(), s, c))
                .map(tuple -> {
                    OrchestrationResult run = tuple.getT1();
                    ScoreBreakdown scores = scoringEngine.score(run.pool());
                    Decision decision = decisionEngine.decide(scores, run.pool(), run.summary());
                    log.info("analysis drug='{}' condition='{}' case={} score={} verdict={} collectors={}/{} elapsedMs={}",
                            s, c, run.summary().getCaseType(), scores.getOverallScore(), decision.verdict(),
                            run.summary().getAgentsSuccessful(), run.summary().getAgentsExecuted(),
                            run.summary().getTotalElapsedMs());
                    return new AnalysisResult(
                            s,
                            c,
                            run.summary().getCaseType(),
                            scores.getOverallScore(),
                            decision.verdict(),
                            scores.getConfidence(),
                            decision.confidenceLabel(),
                            decision.recommendation(),
                            decision.reasoning(),
                            decision.riskFactors(),
                            decision.nextSteps(),
                            scores,
                            run.pool(),
                            run.summary(),
                            tuple.getT2(),
                            OffsetDateTime.now());
                });
    }
}
