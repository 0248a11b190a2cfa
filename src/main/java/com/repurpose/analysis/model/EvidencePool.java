package com.repurpose.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import com.repurpose.analysis.model.evidence.CategoryEvidence;
import com.repurpose.analysis.model.evidence.LiteratureEvidence;
import com.repurpose.analysis.model.evidence.MarketEvidence;
import com.repurpose.analysis.model.evidence.PatentEvidence;
import com.repurpose.analysis.model.evidence.RegulatoryEvidence;
import com.repurpose.analysis.model.evidence.TrialsEvidence;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-request evidence, one record per required category. Failed collectors are represented
 * by their category's neutral record, never by a missing key.
 */
public final class EvidencePool {
    private final Map<CollectorId, CategoryEvidence> records;

    public EvidencePool(Map<CollectorId, ? extends CategoryEvidence> records) {
        EnumMap<CollectorId, CategoryEvidence> copy = new EnumMap<>(CollectorId.class);
        if (records != null) {
            for (Map.Entry<CollectorId, ? extends CategoryEvidence> e : records.entrySet()) {
                CategoryEvidence value = e.getValue();
                if (value != null && value.collectorId() != e.getKey()) {
                    throw new IllegalArgumentException("Evidence for " + value.collectorId() + " placed in slot " + e.getKey());
                }
                copy.put(e.getKey(), value);
            }
        }
        this.records = Collections.unmodifiableMap(copy);
    }

    /** Neutral record for a category, used when its collector failed or never ran. */
    public static CategoryEvidence neutralFor(CollectorId id) {
        return switch (id) {
            case LITERATURE -> LiteratureEvidence.neutral();
            case TRIALS -> TrialsEvidence.neutral();
            case PATENTS -> PatentEvidence.neutral();
            case REGULATORY -> RegulatoryEvidence.neutral();
            case MARKET -> MarketEvidence.neutral();
        };
    }

    @JsonIgnore
    public Set<CollectorId> categories() { return records.keySet(); }

    public boolean contains(CollectorId id) { return records.containsKey(id); }

    public CategoryEvidence get(CollectorId id) { return records.get(id); }

    @JsonIgnore
    public int size() { return records.size(); }

    /** Number of categories whose record came from a successful collector. */
    @JsonIgnore
    public int retrievedCount() {
        int n = 0;
        for (CategoryEvidence e : records.values()) {
            if (e != null && e.isRetrieved()) n++;
        }
        return n;
    }

    public LiteratureEvidence literature() { return (LiteratureEvidence) records.get(CollectorId.LITERATURE); }
    public TrialsEvidence trials() { return (TrialsEvidence) records.get(CollectorId.TRIALS); }
    public PatentEvidence patents() { return (PatentEvidence) records.get(CollectorId.PATENTS); }
    public RegulatoryEvidence regulatory() { return (RegulatoryEvidence) records.get(CollectorId.REGULATORY); }
    public MarketEvidence market() { return (MarketEvidence) records.get(CollectorId.MARKET); }

    /** Serialized form keyed by category name, e.g. {"literature": {...}, "regulatory": {...}}. */
    @JsonValue
    public Map<String, CategoryEvidence> byCategory() {
        Map<String, CategoryEvidence> out = new LinkedHashMap<>();
        records.forEach((id, e) -> out.put(id.getCategory(), e));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvidencePool other)) return false;
        return records.equals(other.records);
    }

    @Override
    public int hashCode() { return records.hashCode(); }
}
