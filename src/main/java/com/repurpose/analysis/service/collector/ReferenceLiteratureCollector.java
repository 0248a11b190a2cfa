package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.ReferenceRecord;
import com.repurpose.analysis.model.evidence.LiteratureEvidence;
import com.repurpose.analysis.model.evidence.LiteratureEvidence.Paper;
import com.repurpose.analysis.service.reference.MedicineRow;
import com.repurpose.analysis.service.reference.ReferenceDataset;
import com.repurpose.analysis.util.TextMatch;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Offline literature variant: one evidence item per indication the reference dataset documents
 * for the subject. Used when outbound literature search is disabled.
 */
public class ReferenceLiteratureCollector implements EvidenceCollector<LiteratureEvidence> {
    static final int MATCHING_INDICATION_RELEVANCE = 90;
    static final int OTHER_INDICATION_RELEVANCE = 60;
    private static final String SOURCE = "Reference dataset";

    private final ReferenceDataset dataset;

    public ReferenceLiteratureCollector(ReferenceDataset dataset) {
        this.dataset = dataset;
    }

    @Override
    public CollectorId id() {
        return CollectorId.LITERATURE;
    }

    @Override
    public Mono<LiteratureEvidence> collect(String subject, String condition) {
        return Mono.fromCallable(() -> build(subject, condition))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private LiteratureEvidence build(String subject, String condition) {
        String query = (subject + " " + condition).trim();
        if (TextMatch.isBlank(subject)) {
            return new LiteratureEvidence(fromIndication(condition), query, SOURCE);
        }
        ReferenceRecord record = dataset.lookup(subject);
        List<Paper> papers = new ArrayList<>();
        for (String indication : record.indications()) {
            boolean matches = !TextMatch.isBlank(condition)
                    && TextMatch.normalize(indication).contains(TextMatch.normalize(condition));
            String category = String.join(", ", record.categories());
            Paper p = new Paper(
                    record.name() + " for " + indication,
                    "Reference dataset",
                    SOURCE,
                    0,
                    matches ? MATCHING_INDICATION_RELEVANCE : OTHER_INDICATION_RELEVANCE,
                    record.name() + " is documented for " + indication
                            + (category.isEmpty() ? "" : " (category: " + category + ")")
                            + " across " + record.recordCount() + " dataset record(s).");
            papers.add(p);
        }
        // Documented uses matching the condition first
        papers.sort((a, b) -> Integer.compare(b.getRelevance(), a.getRelevance()));
        return new LiteratureEvidence(papers, query, SOURCE);
    }

    private List<Paper> fromIndication(String condition) {
        List<Paper> papers = new ArrayList<>();
        for (MedicineRow row : dataset.findByIndication(condition, 5)) {
            papers.add(new Paper(
                    row.name() + " for " + row.indication(),
                    "Reference dataset",
                    SOURCE,
                    0,
                    MATCHING_INDICATION_RELEVANCE,
                    row.name() + " (" + row.category() + ", " + row.dosageForm() + ") is documented for " + row.indication() + "."));
        }
        return papers;
    }
}
