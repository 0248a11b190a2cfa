package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.ErrorKind;
import com.repurpose.analysis.model.ResultEnvelope;
import com.repurpose.analysis.model.evidence.CategoryEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Runs one {@link EvidenceCollector} under a time budget and folds every outcome into a
 * {@link ResultEnvelope}. The returned Mono never errors.
 *
 * <ul>
 *   <li>evidence of the collector's own category before the deadline: success envelope</li>
 *   <li>evidence of another category: {@link ErrorKind#FAULT} envelope</li>
 *   <li>deadline first: {@link ErrorKind#TIMEOUT} envelope, the collector's subscription is cancelled</li>
 *   <li>any error (including one thrown while assembling the collector's Mono) or an empty
 *       completion: {@link ErrorKind#FAULT} envelope with the error description</li>
 * </ul>
 *
 * No outcome is retried here.
 */
@Component
public class CollectorRunner {
    private static final Logger log = LoggerFactory.getLogger(CollectorRunner.class);

    public Mono<ResultEnvelope> run(EvidenceCollector<?> collector, String subject, String condition, Duration budget) {
        CollectorId id = collector.id();
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return Mono.defer(() -> collector.collect(subject, condition))
                    .cast(CategoryEvidence.class)
                    .timeout(budget)
                    .map(payload -> payload.collectorId() == id
                            ? ResultEnvelope.success(id, payload, elapsedMs(startNanos))
                            : ResultEnvelope.failure(id, ErrorKind.FAULT, id.getAgentName() + " returned "
                                    + payload.collectorId() + " evidence", elapsedMs(startNanos)))
                    .switchIfEmpty(Mono.fromSupplier(() ->
                            ResultEnvelope.failure(id, ErrorKind.FAULT, id.getAgentName() + " returned no evidence", elapsedMs(startNanos))))
                    .onErrorResume(e -> Mono.just(toFailure(id, e, budget, elapsedMs(startNanos))))
                    .doOnNext(env -> log.debug("Collector {} ({}) settled: {}", id, collector.getName(), env));
        });
    }

    private static ResultEnvelope toFailure(CollectorId id, Throwable e, Duration budget, long elapsedMs) {
        if (e instanceof TimeoutException) {
            return ResultEnvelope.failure(id, ErrorKind.TIMEOUT,
                    id.getAgentName() + " timed out after " + formatBudget(budget), elapsedMs);
        }
        return ResultEnvelope.failure(id, ErrorKind.FAULT, describe(e), elapsedMs);
    }

    static String describe(Throwable e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return msg;
    }

    private static String formatBudget(Duration budget) {
        long ms = budget.toMillis();
        return ms % 1000 == 0 ? (ms / 1000) + "s" : ms + "ms";
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
