package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.evidence.CategoryEvidence;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Test collector with a scripted outcome and an invocation counter.
 */
public class StubCollector<E extends CategoryEvidence> implements EvidenceCollector<E> {
    private final CollectorId id;
    private final Supplier<Mono<E>> behaviour;
    private final AtomicInteger invocations = new AtomicInteger();

    public StubCollector(CollectorId id, Supplier<Mono<E>> behaviour) {
        this.id = id;
        this.behaviour = behaviour;
    }

    public static <E extends CategoryEvidence> StubCollector<E> returning(E evidence) {
        return new StubCollector<>(evidence.collectorId(), () -> Mono.just(evidence));
    }

    public static <E extends CategoryEvidence> StubCollector<E> delayed(E evidence, Duration delay) {
        return new StubCollector<>(evidence.collectorId(), () -> Mono.delay(delay).thenReturn(evidence));
    }

    /** Never emits, so only the runner's deadline ends it. */
    public static <E extends CategoryEvidence> StubCollector<E> hanging(CollectorId id) {
        return new StubCollector<>(id, Mono::never);
    }

    public static <E extends CategoryEvidence> StubCollector<E> failing(CollectorId id, String message) {
        return new StubCollector<>(id, () -> Mono.error(new CollectorException(id, message)));
    }

    @Override
    public CollectorId id() {
        return id;
    }

    @Override
    public Mono<E> collect(String subject, String condition) {
        invocations.incrementAndGet();
        return behaviour.get();
    }

    public int invocations() {
        return invocations.get();
    }
}
