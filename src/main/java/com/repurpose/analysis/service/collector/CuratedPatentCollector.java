package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.evidence.PatentEvidence;
import com.repurpose.analysis.model.evidence.PatentEvidence.Patent;
import com.repurpose.analysis.util.TextMatch;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Patent landscape from a curated table of known repurposing-related patents.
 */
public class CuratedPatentCollector implements EvidenceCollector<PatentEvidence> {
    static final int MAX_PATENTS = 5;
    private static final String SOURCE = "Curated patent records";

    private static final Map<String, List<Patent>> KNOWN = Map.of(
            "metformin", List.of(
                    new Patent("US20230158421A1", "Methods of treating polycystic ovary syndrome with metformin",
                            "Pending", "2023-05-10", "University of Texas System"),
                    new Patent("EP3243521B1", "Metformin for use in the treatment of cancer",
                            "Granted", "2016-11-15", "Institut National de la Santé et de la Recherche Médicale")),
            "aspirin", List.of(
                    new Patent("US20150086545A1", "Aspirin formulations for cardiovascular prevention",
                            "Granted", "2014-03-25", "Bayer Healthcare LLC")),
            "sildenafil", List.of(
                    new Patent("US5955471A", "Pyrazolopyrimidinones for the treatment of impotence",
                            "Granted", "1991-08-13", "Pfizer Inc"))
    );

    @Override
    public CollectorId id() {
        return CollectorId.PATENTS;
    }

    @Override
    public Mono<PatentEvidence> collect(String subject, String condition) {
        return Mono.fromCallable(() -> new PatentEvidence(lookup(subject), SOURCE));
    }

    static List<Patent> lookup(String subject) {
        String key = TextMatch.normalize(subject);
        List<Patent> out = new ArrayList<>();
        if (key.isEmpty()) return out;
        KNOWN.forEach((drug, patents) -> {
            if (key.contains(drug)) out.addAll(patents);
        });
        return out.size() > MAX_PATENTS ? out.subList(0, MAX_PATENTS) : out;
    }
}
