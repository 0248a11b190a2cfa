package com.repurpose.analysis.service;

import com.repurpose.analysis.model.CaseInsights;
import com.repurpose.analysis.model.CaseInsights.IngredientProfile;
import com.repurpose.analysis.model.CaseInsights.Suggestion;
import com.repurpose.analysis.model.CaseType;
import com.repurpose.analysis.model.ReferenceRecord;
import com.repurpose.analysis.service.reference.MedicineRow;
import com.repurpose.analysis.service.reference.ReferenceDataset;
import com.repurpose.analysis.util.TextMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Case-specific findings from the reference dataset: new indications for a known drug, candidate
 * drugs for a condition, or an ingredient-class profile with alternative uses.
 */
@Service
public class CaseInsightService {
    private static final Logger log = LoggerFactory.getLogger(CaseInsightService.class);

    static final int MAX_SUGGESTIONS = 10;
    static final int SAME_CATEGORY_CONFIDENCE = 75;
    static final int CANDIDATE_CONFIDENCE = 90;
    private static final int CATEGORY_SCAN_LIMIT = 50;
    private static final int INDICATION_SCAN_LIMIT = 20;

    private static final Map<String, String> MECHANISMS = Map.of(
            "Antibiotic", "Inhibits bacterial cell wall synthesis or protein synthesis",
            "Antiviral", "Blocks viral replication or entry into cells",
            "Antifungal", "Disrupts fungal cell membrane integrity",
            "Antidiabetic", "Regulates glucose metabolism and insulin sensitivity",
            "Analgesic", "Blocks pain signal transmission",
            "Anti-inflammatory", "Reduces inflammatory mediators",
            "Antihypertensive", "Reduces blood pressure through various pathways",
            "Antihistamine", "Blocks histamine receptors");

    private static final Map<String, List<String>> PROPERTIES = Map.of(
            "Antibiotic", List.of("Bactericidal", "Bacteriostatic", "Broad/Narrow spectrum"),
            "Antiviral", List.of("Viral inhibition", "Immune modulation"),
            "Antifungal", List.of("Fungicidal", "Fungistatic"),
            "Antidiabetic", List.of("Glucose regulation", "Insulin sensitivity"),
            "Analgesic", List.of("Pain relief", "Anti-pyretic"),
            "Anti-inflammatory", List.of("COX inhibition", "Cytokine modulation"),
            "Antihypertensive", List.of("Vasodilation", "Diuretic effect"),
            "Antihistamine", List.of("H1 blocking", "Sedative/Non-sedative"));

    private final ReferenceDataset dataset;

    public CaseInsightService(ReferenceDataset dataset) {
        this.dataset = dataset;
    }

    /** Never errors; a dataset problem yields insights carrying only the case type. */
    public Mono<CaseInsights> insightsFor(CaseType caseType, String subject, String condition) {
        return Mono.fromCallable(() -> compute(caseType, subject, condition))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Case insights failed for case={} subject='{}' condition='{}': {}", caseType, subject, condition, e.toString());
                    return Mono.just(emptyInsights(caseType));
                });
    }

    CaseInsights compute(CaseType caseType, String subject, String condition) {
        return switch (caseType) {
            case SUBJECT_ONLY -> subjectOnly(subject);
            case CONDITION_ONLY -> conditionOnly(condition);
            case INGREDIENT_MODE -> ingredientMode(subject);
            case SUBJECT_AND_CONDITION -> subjectAndCondition(subject, condition);
        };
    }

    private CaseInsights subjectOnly(String subject) {
        if (TextMatch.isBlank(subject)) {
            return new CaseInsights(CaseType.SUBJECT_ONLY, null, List.of(), List.of(), List.of(), null, null,
                    List.of("No drug or condition supplied"));
        }
        ReferenceRecord record = dataset.lookup(subject);
        if (record.isEmpty()) {
            return new CaseInsights(CaseType.SUBJECT_ONLY, null, List.of(), List.of(), List.of(), null, null,
                    List.of(subject + " not found in reference dataset"));
        }
        String category = record.primaryCategory();
        Set<String> indications = new LinkedHashSet<>();
        for (MedicineRow row : dataset.findByCategory(category, INDICATION_SCAN_LIMIT)) {
            if (!TextMatch.isBlank(row.indication())) indications.add(row.indication());
        }
        record.indications().forEach(indications::remove);

        List<Suggestion> potential = new ArrayList<>();
        for (String ind : indications) {
            if (potential.size() >= MAX_SUGGESTIONS) break;
            potential.add(new Suggestion(ind, SAME_CATEGORY_CONFIDENCE, "Other " + category + " drugs are used for this condition"));
        }
        List<String> highlights = List.of(
                record.name() + " is a " + (category.isEmpty() ? "Unknown" : category) + " drug",
                "Current uses: " + String.join(", ", record.indications()),
                "Found " + potential.size() + " potential new disease targets");
        return new CaseInsights(CaseType.SUBJECT_ONLY, record, record.indications(), potential, List.of(), null, null, highlights);
    }

    private CaseInsights conditionOnly(String condition) {
        Map<String, Suggestion> candidates = new LinkedHashMap<>();
        for (MedicineRow row : dataset.findByIndication(condition, INDICATION_SCAN_LIMIT)) {
            if (candidates.size() >= MAX_SUGGESTIONS) break;
            candidates.putIfAbsent(TextMatch.normalize(row.name()), new Suggestion(row.name(), CANDIDATE_CONFIDENCE,
                    row.category() + ", " + row.dosageForm() + ", " + row.classification()));
        }
        List<Suggestion> list = new ArrayList<>(candidates.values());
        List<String> highlights = new ArrayList<>();
        highlights.add("Found " + list.size() + " drug candidates for " + condition);
        if (!list.isEmpty()) highlights.add("Top candidate: " + list.get(0).name());
        return new CaseInsights(CaseType.CONDITION_ONLY, null, List.of(), List.of(), list, null, null, highlights);
    }

    private CaseInsights ingredientMode(String subject) {
        ReferenceRecord record = dataset.lookup(subject);
        if (record.isEmpty()) {
            return new CaseInsights(CaseType.INGREDIENT_MODE, null, List.of(), List.of(), List.of(), null, null,
                    List.of(subject + " not found in reference dataset"));
        }
        String category = record.primaryCategory();
        IngredientProfile profile = profileFor(category);

        String currentIndication = record.indications().isEmpty() ? "" : record.indications().get(0);
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (MedicineRow row : dataset.findByCategory(category, CATEGORY_SCAN_LIMIT)) {
            String ind = row.indication();
            if (!TextMatch.isBlank(ind) && !ind.equals(currentIndication)) {
                counts.merge(ind, 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<Suggestion> alternatives = new ArrayList<>();
        for (Map.Entry<String, Integer> e : ranked) {
            if (alternatives.size() >= MAX_SUGGESTIONS) break;
            int count = e.getValue();
            alternatives.add(new Suggestion(e.getKey(), Math.min(95, 50 + count * 5),
                    count + " other " + category + " drugs treat this condition"));
        }
        List<String> highlights = new ArrayList<>();
        highlights.add("Category: " + category);
        highlights.add("Current use: " + (currentIndication.isEmpty() ? "Unknown" : currentIndication));
        highlights.add("Found " + alternatives.size() + " potential alternative uses");
        if (!alternatives.isEmpty()) {
            highlights.add("Best alternative: " + alternatives.get(0).name() + " (" + alternatives.get(0).confidence() + "% confidence)");
        }
        return new CaseInsights(CaseType.INGREDIENT_MODE, record, record.indications(), alternatives, List.of(), profile, null, highlights);
    }

    private CaseInsights subjectAndCondition(String subject, String condition) {
        ReferenceRecord record = dataset.lookup(subject);
        boolean documented = record.documentsIndication(condition);
        List<String> highlights = new ArrayList<>();
        if (documented) {
            highlights.add(record.name() + " is already documented for " + condition + " (" + record.recordCount() + " records)");
        } else if (record.isEmpty()) {
            highlights.add(subject + " not found in reference dataset");
        } else {
            highlights.add(record.name() + " is not documented for " + condition + "; this would be a new indication");
        }
        return new CaseInsights(CaseType.SUBJECT_AND_CONDITION, record.isEmpty() ? null : record,
                record.indications(), List.of(), List.of(), null, documented, highlights);
    }

    public static IngredientProfile profileFor(String category) {
        String mechanism = MECHANISMS.getOrDefault(category, "Mechanism specific to " + category + " class");
        List<String> properties = PROPERTIES.getOrDefault(category, List.of("Category-specific properties"));
        return new IngredientProfile(category, mechanism, properties);
    }

    private static CaseInsights emptyInsights(CaseType caseType) {
        return new CaseInsights(caseType, null, List.of(), List.of(), List.of(), null, null, List.of());
    }
}
