package com.repurpose.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Metadata of one orchestration run: which collectors were executed, which succeeded and how long
 * each took. Drives confidence and the per-collector risk factors.
 */
public final class RunSummary {
    private final CaseType caseType;
    private final List<CollectorOutcome> outcomes;
    private final long totalElapsedMs;

    public RunSummary(CaseType caseType, List<CollectorOutcome> outcomes, long totalElapsedMs) {
        this.caseType = caseType;
        this.outcomes = outcomes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.totalElapsedMs = totalElapsedMs;
    }

    public CaseType getCaseType() { return caseType; }
    public List<CollectorOutcome> getOutcomes() { return outcomes; }
    public long getTotalElapsedMs() { return totalElapsedMs; }

    public List<CollectorId> getExecuted() {
        return outcomes.stream().map(CollectorOutcome::getCollectorId).toList();
    }

    public List<CollectorId> getSucceeded() {
        return outcomes.stream().filter(CollectorOutcome::isSuccess).map(CollectorOutcome::getCollectorId).toList();
    }

    public List<CollectorId> getFailed() {
        return outcomes.stream().filter(o -> !o.isSuccess()).map(CollectorOutcome::getCollectorId).toList();
    }

    public int getAgentsExecuted() { return outcomes.size(); }

    public int getAgentsSuccessful() { return getSucceeded().size(); }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CollectorOutcome {
        private final CollectorId collectorId;
        private final boolean success;
        private final ErrorKind errorKind;
        private final String error;
        private final long elapsedMs;

        public CollectorOutcome(CollectorId collectorId, boolean success, ErrorKind errorKind, String error, long elapsedMs) {
            this.collectorId = collectorId;
            this.success = success;
            this.errorKind = errorKind;
            this.error = error;
            this.elapsedMs = elapsedMs;
        }

        public static CollectorOutcome of(ResultEnvelope envelope) {
            return new CollectorOutcome(envelope.getCollectorId(), envelope.isSuccess(),
                    envelope.getErrorKind(), envelope.getError(), envelope.getElapsedMs());
        }

        public CollectorId getCollectorId() { return collectorId; }
        public String getAgent() { return collectorId.getAgentName(); }
        public boolean isSuccess() { return success; }
        public ErrorKind getErrorKind() { return errorKind; }
        public String getError() { return error; }
        public long getElapsedMs() { return elapsedMs; }
    }
}
