package com.repurpose.analysis.service.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.evidence.TrialsEvidence;
import com.repurpose.analysis.model.evidence.TrialsEvidence.Trial;
import com.repurpose.analysis.util.TextMatch;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Clinical-trial evidence from the ClinicalTrials.gov v2 studies API.
 */
public class ClinicalTrialsGovCollector implements EvidenceCollector<TrialsEvidence> {
    static final int PAGE_SIZE = 10;
    static final int MAX_TRIALS = 8;
    private static final String SOURCE = "ClinicalTrials.gov";

    private final WebClient http;

    public ClinicalTrialsGovCollector(@Qualifier("clinicalTrialsClient") WebClient http) {
        this.http = http;
    }

    @Override
    public CollectorId id() {
        return CollectorId.TRIALS;
    }

    @Override
    public Mono<TrialsEvidence> collect(String subject, String condition) {
        String intr = TextMatch.sanitizeQuery(subject);
        String cond = TextMatch.sanitizeQuery(condition);
        return http.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/api/v2/studies");
                    if (!cond.isEmpty()) uriBuilder.queryParam("query.cond", "{cond}");
                    if (!intr.isEmpty()) uriBuilder.queryParam("query.intr", "{intr}");
                    uriBuilder.queryParam("pageSize", PAGE_SIZE).queryParam("format", "json");
                    List<Object> vars = new ArrayList<>();
                    if (!cond.isEmpty()) vars.add(cond);
                    if (!intr.isEmpty()) vars.add(intr);
                    return uriBuilder.build(vars.toArray());
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(body -> new TrialsEvidence(parseStudies(body), SOURCE))
                .defaultIfEmpty(new TrialsEvidence(List.of(), SOURCE))
                .onErrorMap(WebClientException.class,
                        e -> new CollectorException(id(), "ClinicalTrials.gov request failed: " + e.getMessage(), e));
    }

    static List<Trial> parseStudies(JsonNode body) {
        List<Trial> out = new ArrayList<>();
        JsonNode studies = body == null ? null : body.path("studies");
        if (studies == null || !studies.isArray()) return out;
        for (JsonNode study : studies) {
            if (out.size() >= MAX_TRIALS) break;
            out.add(extractTrial(study));
        }
        return out;
    }

    static Trial extractTrial(JsonNode study) {
        JsonNode protocol = study.path("protocolSection");
        JsonNode identification = protocol.path("identificationModule");
        JsonNode status = protocol.path("statusModule");
        JsonNode design = protocol.path("designModule");

        String nctId = identification.path("nctId").asText("N/A");
        String title = identification.path("officialTitle").asText("");
        if (title.isEmpty()) title = identification.path("briefTitle").asText("Title not available");

        String phase = "N/A";
        JsonNode phases = design.path("phases");
        if (phases.isArray() && phases.size() > 0) phase = phases.get(0).asText("N/A");

        Trial trial = new Trial(nctId, title, status.path("overallStatus").asText("Unknown"), phase);
        trial.setParticipants(status.path("enrollmentInfo").path("count").asInt(0));
        trial.setCompletionDate(status.path("completionDateStruct").path("date").asText("Unknown"));
        trial.setUrl("N/A".equals(nctId) ? "" : "https://clinicaltrials.gov/ct2/show/" + nctId);
        return trial;
    }
}
