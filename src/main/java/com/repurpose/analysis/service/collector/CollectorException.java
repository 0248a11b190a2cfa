package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;

/**
 * Raised by a collector when its source could not produce evidence (upstream outage, bad
 * response shape, parse error).
 */
public class CollectorException extends RuntimeException {
    private final CollectorId collectorId;

    public CollectorException(CollectorId collectorId, String message) {
        super(message);
        this.collectorId = collectorId;
    }

    public CollectorException(CollectorId collectorId, String message, Throwable cause) {
        super(message, cause);
        this.collectorId = collectorId;
    }

    public CollectorId getCollectorId() {
        return collectorId;
    }
}
