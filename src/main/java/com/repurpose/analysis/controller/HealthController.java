package com.repurpose.analysis.controller;

import com.repurpose.analysis.service.reference.ReferenceDataset;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
public class HealthController {
    private final ReferenceDataset dataset;

    public HealthController(ReferenceDataset dataset) { this.dataset = dataset; }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(dataset::size)
                .subscribeOn(Schedulers.boundedElastic())
                .map(size -> ResponseEntity.ok(Map.<String, Object>of("ok", Boolean.TRUE, "reference_records", size)))
                .onErrorReturn(ResponseEntity.status(500).body(Map.<String, Object>of("ok", Boolean.FALSE)));
    }
}
