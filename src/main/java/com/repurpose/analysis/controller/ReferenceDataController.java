package com.repurpose.analysis.controller;

import com.repurpose.analysis.dto.AnalysisDtos;
import com.repurpose.analysis.model.ReferenceRecord;
import com.repurpose.analysis.service.CaseInsightService;
import com.repurpose.analysis.service.reference.ReferenceDataset;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Tag(name = "reference")
public class ReferenceDataController {
    static final int SUGGESTION_LIMIT = 10;
    static final int BY_CONDITION_LIMIT = 50;

    private final ReferenceDataset dataset;

    public ReferenceDataController(ReferenceDataset dataset) {
        this.dataset = dataset;
    }

    @GetMapping("/api/drugs/suggestions")
    public Mono<AnalysisDtos.SuggestionsResponseBody> drugSuggestions(@RequestParam(name = "query", defaultValue = "") String query) {
        return Mono.fromCallable(() -> new AnalysisDtos.SuggestionsResponseBody(query, dataset.suggestNames(query, SUGGESTION_LIMIT)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/conditions/suggestions")
    public Mono<AnalysisDtos.SuggestionsResponseBody> conditionSuggestions(@RequestParam(name = "query", defaultValue = "") String query) {
        return Mono.fromCallable(() -> new AnalysisDtos.SuggestionsResponseBody(query, dataset.suggestIndications(query, SUGGESTION_LIMIT)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/medicines/search")
    public Mono<AnalysisDtos.MedicineSearchResponseBody> searchMedicine(@RequestParam(name = "drug_name") String drugName) {
        return Mono.fromCallable(() -> {
            ReferenceRecord record = dataset.lookup(drugName);
            return new AnalysisDtos.MedicineSearchResponseBody(!record.isEmpty(), record.isEmpty() ? null : record);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/medicines/by-condition")
    public Mono<AnalysisDtos.MedicinesByConditionResponseBody> medicinesByCondition(@RequestParam(name = "condition") String condition) {
        return Mono.fromCallable(() -> new AnalysisDtos.MedicinesByConditionResponseBody(condition,
                        dataset.findByIndication(condition, BY_CONDITION_LIMIT)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/medicines/{drug_name}/details")
    public Mono<AnalysisDtos.MedicineDetailsResponseBody> medicineDetails(@PathVariable("drug_name") String drugName) {
        return Mono.fromCallable(() -> {
            ReferenceRecord record = dataset.lookup(drugName);
            if (record.isEmpty()) {
                return new AnalysisDtos.MedicineDetailsResponseBody(false, null);
            }
            AnalysisDtos.MedicineDetails details = new AnalysisDtos.MedicineDetails(record,
                    CaseInsightService.profileFor(record.primaryCategory()));
            return new AnalysisDtos.MedicineDetailsResponseBody(true, details);
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
