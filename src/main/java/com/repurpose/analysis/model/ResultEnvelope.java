package com.repurpose.analysis.model;

import com.repurpose.analysis.model.evidence.CategoryEvidence;

import java.util.Objects;

/**
 * Uniform outcome of one collector run. Exactly one of {@link #getPayload()} and
 * {@link #getError()} is non-null.
 */
public final class ResultEnvelope {
    private final CollectorId collectorId;
    private final CategoryEvidence payload;
    private final ErrorKind errorKind;
    private final String error;
    private final long elapsedMs;

    private ResultEnvelope(CollectorId collectorId, CategoryEvidence payload, ErrorKind errorKind, String error, long elapsedMs) {
        this.collectorId = Objects.requireNonNull(collectorId, "collectorId");
        this.payload = payload;
        this.errorKind = errorKind;
        this.error = error;
        this.elapsedMs = Math.max(0L, elapsedMs);
    }

    public static ResultEnvelope success(CollectorId collectorId, CategoryEvidence payload, long elapsedMs) {
        return new ResultEnvelope(collectorId, Objects.requireNonNull(payload, "payload"), null, null, elapsedMs);
    }

    public static ResultEnvelope failure(CollectorId collectorId, ErrorKind kind, String error, long elapsedMs) {
        String message = (error == null || error.isBlank()) ? collectorId.getAgentName() + " failed" : error;
        return new ResultEnvelope(collectorId, null, Objects.requireNonNull(kind, "kind"), message, elapsedMs);
    }

    public CollectorId getCollectorId() { return collectorId; }
    public boolean isSuccess() { return payload != null; }
    public CategoryEvidence getPayload() { return payload; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getError() { return error; }
    public long getElapsedMs() { return elapsedMs; }

    @Override
    public String toString() {
        return isSuccess()
                ? collectorId + "[ok " + elapsedMs + "ms]"
                : collectorId + "[" + errorKind + " " + elapsedMs + "ms: " + error + "]";
    }
}
