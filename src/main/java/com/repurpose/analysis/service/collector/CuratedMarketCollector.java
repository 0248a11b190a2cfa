package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.evidence.MarketEvidence;
import com.repurpose.analysis.util.TextMatch;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Market opportunity from a table of condition profiles, matched by substring of the condition.
 */
public class CuratedMarketCollector implements EvidenceCollector<MarketEvidence> {

    record Profile(String size, String growth, String competition, String unmetNeed, String population) {}

    // First match wins; insertion order matters for overlapping keys
    private static final Map<String, Profile> PROFILES = new LinkedHashMap<>();
    static {
        PROFILES.put("cancer", new Profile("$230B", "7.5% CAGR", "High", "Moderate", "19.5M new cases/year globally"));
        PROFILES.put("pcos", new Profile("$4.2B", "8.3% CAGR", "Low-Moderate", "High", "6-26% of women of reproductive age"));
        PROFILES.put("cardiovascular", new Profile("$180B", "5.2% CAGR", "High", "Moderate", "17.9M deaths/year globally"));
        PROFILES.put("hypertension", new Profile("$45B", "4.1% CAGR", "High", "Low", "1.28B cases globally"));
        PROFILES.put("diabetes", new Profile("$95B", "5.6% CAGR", "High", "Moderate", "537M cases globally"));
        PROFILES.put("alzheimer", new Profile("$15B", "9.2% CAGR", "Moderate", "Very High", "57M cases globally"));
    }

    static final Profile DEFAULT_PROFILE = new Profile("$2-10B", "6-8% CAGR", "Moderate", "Moderate", "To be determined");

    @Override
    public CollectorId id() {
        return CollectorId.MARKET;
    }

    @Override
    public Mono<MarketEvidence> collect(String subject, String condition) {
        return Mono.fromCallable(() -> {
            Profile p = profileFor(condition);
            MarketEvidence ev = new MarketEvidence(p.size(), p.growth(), p.competition(), p.unmetNeed(), p.population());
            ev.setTimeline("18-36 months to commercialization");
            ev.setExclusivity("3-7 years market exclusivity potential");
            return ev;
        });
    }

    static Profile profileFor(String condition) {
        String key = TextMatch.normalize(condition);
        if (!key.isEmpty()) {
            for (Map.Entry<String, Profile> e : PROFILES.entrySet()) {
                if (key.contains(e.getKey())) return e.getValue();
            }
            if (key.contains("polycystic")) return PROFILES.get("pcos");
        }
        return DEFAULT_PROFILE;
    }
}
