package com.repurpose.analysis.controller;

import com.repurpose.analysis.config.AppProperties;
import com.repurpose.analysis.dto.AnalysisDtos;
import com.repurpose.analysis.model.AnalysisResult;
import com.repurpose.analysis.service.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@RestController
@Tag(name = "analysis")
public class AnalysisController {
    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;
    private final AppProperties appProperties;

    public AnalysisController(AnalysisService analysisService, AppProperties appProperties) {
        this.analysisService = analysisService;
        this.appProperties = appProperties;
    }

    /**
     * Runs the full repurposing analysis. Either field may be omitted; collector failures are
     * reported inside the result, never as an HTTP error.
     */
    @PostMapping("/api/analyze")
    @Operation(summary = "Analyze a drug / condition pair")
    public Mono<AnalysisResult> analyze(@Valid @RequestBody AnalysisDtos.AnalyzeRequestBody body) {
        int max = appProperties.getMaxInputLength();
        checkLength("drug_name", body.getDrugName(), max);
        checkLength("target_condition", body.getTargetCondition(), max);
        log.debug("/api/analyze drug='{}' condition='{}' ingredients={}",
                body.getDrugName(), body.getTargetCondition(), body.ingredientMode());
        return analysisService.runAnalysis(body.getDrugName(), body.getTargetCondition(), body.ingredientMode());
    }

    private static void checkLength(String field, String value, int max) {
        if (value != null && value.trim().length() > max) {
            throw new ServerWebInputException(field + " must be at most " + max + " characters");
        }
    }
}
