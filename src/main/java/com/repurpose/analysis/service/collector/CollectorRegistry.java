package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The collector variant and time budget in effect for each category. Built once at startup from
 * configuration; immutable afterwards.
 */
public final class CollectorRegistry {
    private final Map<CollectorId, EvidenceCollector<?>> collectors;
    private final Function<CollectorId, Duration> budgets;

    public CollectorRegistry(Collection<? extends EvidenceCollector<?>> collectors, Function<CollectorId, Duration> budgets) {
        EnumMap<CollectorId, EvidenceCollector<?>> byId = new EnumMap<>(CollectorId.class);
        for (EvidenceCollector<?> c : collectors) {
            EvidenceCollector<?> previous = byId.put(c.id(), c);
            if (previous != null) {
                throw new IllegalStateException("Two collectors registered for " + c.id() + ": "
                        + previous.getName() + " and " + c.getName());
            }
        }
        this.collectors = Collections.unmodifiableMap(byId);
        this.budgets = budgets;
    }

    public Optional<EvidenceCollector<?>> find(CollectorId id) {
        return Optional.ofNullable(collectors.get(id));
    }

    public Duration budgetFor(CollectorId id) {
        return budgets.apply(id);
    }

    public Map<CollectorId, EvidenceCollector<?>> all() {
        return collectors;
    }
}
