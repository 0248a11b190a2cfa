package com.repurpose.analysis.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repurpose.analysis.EvidenceFixtures;
import com.repurpose.analysis.config.AppProperties;
import com.repurpose.analysis.config.WebClientConfig;
import com.repurpose.analysis.service.AnalysisOrchestrator;
import com.repurpose.analysis.service.AnalysisService;
import com.repurpose.analysis.service.CaseInsightService;
import com.repurpose.analysis.service.CaseRouter;
import com.repurpose.analysis.service.collector.CollectorRegistry;
import com.repurpose.analysis.service.collector.CollectorRunner;
import com.repurpose.analysis.service.collector.EvidenceCollector;
import com.repurpose.analysis.service.collector.StubCollector;
import com.repurpose.analysis.service.decision.DecisionEngine;
import com.repurpose.analysis.service.reference.CsvReferenceDataset;
import com.repurpose.analysis.service.scoring.ScoringEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class AnalysisControllerTest {
    private WebTestClient client;

    @BeforeEach
    public void setUp() {
        List<EvidenceCollector<?>> collectors = new ArrayList<>();
        EvidenceFixtures.metforminEvidence().values().forEach(e -> collectors.add(StubCollector.returning(e)));
        CsvReferenceDataset dataset = EvidenceFixtures.smallDataset();
        CaseRouter router = new CaseRouter();
        AnalysisService service = new AnalysisService(
                new AnalysisOrchestrator(router, new CollectorRunner(), new CollectorRegistry(collectors, id -> Duration.ofSeconds(2))),
                new ScoringEngine(), new DecisionEngine(), new CaseInsightService(dataset), router);

        AppProperties props = new AppProperties();
        props.setMaxInputLength(50);
        ObjectMapper mapper = new WebClientConfig().objectMapper();

        client = WebTestClient
                .bindToController(new AnalysisController(service, props), new ReferenceDataController(dataset), new HealthController(dataset))
                .controllerAdvice(new GlobalErrorHandler())
                .httpMessageCodecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
                })
                .build();
    }

    @Test
    public void analyzeReturnsSnakeCaseResult() {
        client.post().uri("/api/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("drug_name", "metformin", "target_condition", "PCOS"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.case_type").isEqualTo("SUBJECT_AND_CONDITION")
                .jsonPath("$.verdict").isEqualTo("GO")
                .jsonPath("$.confidence").isEqualTo(1.0)
                .jsonPath("$.score_breakdown.overall_score").isEqualTo(87)
                .jsonPath("$.score_breakdown.score_breakdown.trials").isEqualTo(88)
                .jsonPath("$.evidence_pool.market.market_size").isEqualTo("$4.2B")
                .jsonPath("$.run_summary.agents_executed").isEqualTo(5);
    }

    @Test
    public void camelCaseRequestKeysAreAccepted() {
        client.post().uri("/api/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("drugName", "metformin", "analyzeIngredients", true))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.case_type").isEqualTo("INGREDIENT_MODE")
                .jsonPath("$.insights.ingredient_profile.ingredient_class").isEqualTo("Antidiabetic");
    }

    @Test
    public void overlongInputIsRejected() {
        client.post().uri("/api/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("drug_name", "x".repeat(60)))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    public void inputAboveHardCapFailsValidation() {
        client.post().uri("/api/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("target_condition", "y".repeat(250)))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request")
                .jsonPath("$.details[0].field").isEqualTo("targetCondition");
    }

    @Test
    public void missingBodyIsRejected() {
        client.post().uri("/api/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    public void drugSuggestions() {
        client.get().uri("/api/drugs/suggestions?query=met")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.suggestions[0]").isEqualTo("Metformin");
    }

    @Test
    public void medicineSearch() {
        client.get().uri("/api/medicines/search?drug_name=aspirin")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.found").isEqualTo(true)
                .jsonPath("$.medicine.categories[0]").isEqualTo("Analgesic");
    }

    @Test
    public void medicinesByConditionListsDocumentedRows() {
        client.get().uri("/api/medicines/by-condition?condition={condition}", "type 2 diabetes")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(3)
                .jsonPath("$.medicines[0].name").isEqualTo("Metformin")
                .jsonPath("$.medicines[0].dosage_form").isEqualTo("Tablet");
    }

    @Test
    public void medicinesByConditionWithoutMatchesIsEmpty() {
        client.get().uri("/api/medicines/by-condition?condition=scurvy")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(0)
                .jsonPath("$.medicines").isEmpty();
    }

    @Test
    public void medicineDetailsIncludeClassProfile() {
        client.get().uri("/api/medicines/{drug}/details", "Aspirin")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.found").isEqualTo(true)
                .jsonPath("$.details.medicine.name").isEqualTo("Aspirin")
                .jsonPath("$.details.marketed_approved").isEqualTo(true)
                .jsonPath("$.details.ingredient_profile.mechanism").isEqualTo("Blocks pain signal transmission");
    }

    @Test
    public void unknownMedicineDetailsAreNotFound() {
        client.get().uri("/api/medicines/{drug}/details", "zzqx")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.found").isEqualTo(false)
                .jsonPath("$.details").isEmpty();
    }

    @Test
    public void health() {
        client.get().uri("/healthz")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true);
    }
}
