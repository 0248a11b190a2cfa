package com.repurpose.analysis.service;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.ErrorKind;
import com.repurpose.analysis.model.EvidencePool;
import com.repurpose.analysis.model.ResultEnvelope;
import com.repurpose.analysis.model.RunSummary;
import com.repurpose.analysis.model.evidence.CategoryEvidence;
import com.repurpose.analysis.service.collector.CollectorRegistry;
import com.repurpose.analysis.service.collector.CollectorRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fans the required collectors out concurrently, waits for every one of them to settle and folds
 * the envelopes into an {@link EvidencePool}.
 *
 * <p>Each collector writes its own category slot, so the fold is independent of completion order.
 * The returned Mono never errors: a failed collector contributes the neutral record for its category.
 */
@Service
public class AnalysisOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final CaseRouter caseRouter;
    private final CollectorRunner runner;
    private final CollectorRegistry registry;

    public AnalysisOrchestrator(CaseRouter caseRouter, CollectorRunner runner, CollectorRegistry registry) {
        this.caseRouter = caseRouter;
        this.runner = runner;
        this.registry = registry;
    }

    public record OrchestrationResult(EvidencePool pool, RunSummary summary) {}

    public Mono<OrchestrationResult> orchestrate(String subject, String condition, boolean ingredientMode) {
        CaseRouter.Routing routing = caseRouter.classify(subject, condition, ingredientMode);
        String s = subject == null ? "" : subject.trim();
        String c = condition == null ? "" : condition.trim();
        List<CollectorId> required = routing.required();
        log.debug("Routed subject='{}' condition='{}' ingredientMode={} to {} with {}",
                s, c, ingredientMode, routing.caseType(), required);

        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return Flux.fromIterable(required)
                    .flatMap(id -> launch(id, s, c), Math.max(1, required.size()))
                    .collectList()
                    .map(envelopes -> fold(routing, envelopes, (System.nanoTime() - startNanos) / 1_000_000L));
        });
    }

    private Mono<ResultEnvelope> launch(CollectorId id, String subject, String condition) {
        return registry.find(id)
                .map(collector -> runner.run(collector, subject, condition, registry.budgetFor(id)))
                .orElseGet(() -> Mono.just(ResultEnvelope.failure(id, ErrorKind.FAULT,
                        "No collector registered for " + id.getCategory(), 0L)));
    }

    static OrchestrationResult fold(CaseRouter.Routing routing, List<ResultEnvelope> envelopes, long totalElapsedMs) {
        Map<CollectorId, ResultEnvelope> byId = new EnumMap<>(CollectorId.class);
        for (ResultEnvelope env : envelopes) {
            byId.put(env.getCollectorId(), env);
        }

        Map<CollectorId, CategoryEvidence> records = new EnumMap<>(CollectorId.class);
        List<RunSummary.CollectorOutcome> outcomes = new ArrayList<>();
        // Summary follows the routing order, not completion order
        for (CollectorId id : routing.required()) {
            ResultEnvelope env = byId.get(id);
            if (env == null) {
                env = ResultEnvelope.failure(id, ErrorKind.FAULT, id.getAgentName() + " did not report", 0L);
            }
            records.put(id, env.isSuccess() ? env.getPayload() : EvidencePool.neutralFor(id));
            outcomes.add(RunSummary.CollectorOutcome.of(env));
        }
        return new OrchestrationResult(new EvidencePool(records),
                new RunSummary(routing.caseType(), outcomes, totalElapsedMs));
    }

}
