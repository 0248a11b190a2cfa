package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.evidence.CategoryEvidence;
import reactor.core.publisher.Mono;

/**
 * Produces one category of evidence for a subject/condition pair.
 *
 * <p>Collectors are the leaves of the analysis: each one knows a single external source (or a
 * curated table) and nothing about scoring or other collectors.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>Emit exactly one evidence record, or signal an error. Completing empty is treated as
 *       a failure by {@link CollectorRunner}.</li>
 *   <li>Do not apply an overall deadline; the runner owns the time budget and cancels the
 *       returned {@link Mono} when it expires.</li>
 *   <li>Retries, if any, are the collector's own concern.</li>
 *   <li>Treat injected resources (e.g. the reference dataset) as read-only.</li>
 * </ul>
 *
 * <p>Either argument may be an empty string depending on the analysed case; it is never
 * {@code null}.
 *
 * @param <E> the evidence variant produced
 * @see CollectorRunner
 */
public interface EvidenceCollector<E extends CategoryEvidence> {

    /** The slot this collector fills. */
    CollectorId id();

    /**
     * Collects evidence for the given subject (drug) and condition.
     *
     * @param subject trimmed drug name, possibly empty
     * @param condition trimmed target condition, possibly empty
     * @return a Mono emitting the evidence record
     */
    Mono<E> collect(String subject, String condition);

    /** Name used in logs; defaults to the simple class name. */
    default String getName() {
        return this.getClass().getSimpleName();
    }
}
