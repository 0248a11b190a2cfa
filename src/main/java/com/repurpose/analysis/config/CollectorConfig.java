package com.repurpose.analysis.config;

import com.repurpose.analysis.service.collector.ClinicalTrialsGovCollector;
import com.repurpose.analysis.service.collector.CollectorRegistry;
import com.repurpose.analysis.service.collector.CuratedMarketCollector;
import com.repurpose.analysis.service.collector.CuratedPatentCollector;
import com.repurpose.analysis.service.collector.EvidenceCollector;
import com.repurpose.analysis.service.collector.PubMedLiteratureCollector;
import com.repurpose.analysis.service.collector.ReferenceLiteratureCollector;
import com.repurpose.analysis.service.collector.RegulatoryCollector;
import com.repurpose.analysis.service.reference.ReferenceDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Wires one collector per category. The literature variant is chosen by {@code app.collectors.mode}.
 */
@Configuration
public class CollectorConfig {
    private static final Logger log = LoggerFactory.getLogger(CollectorConfig.class);

    @Bean
    public CollectorRegistry collectorRegistry(AppProperties appProperties,
                                               ReferenceDataset referenceDataset,
                                               @Qualifier("pubmedClient") WebClient pubmedClient,
                                               @Qualifier("clinicalTrialsClient") WebClient clinicalTrialsClient) {
        AppProperties.Collectors settings = appProperties.getCollectors();
        EvidenceCollector<?> literature = settings.isOffline()
                ? new ReferenceLiteratureCollector(referenceDataset)
                : new PubMedLiteratureCollector(pubmedClient);
        log.info("Collectors mode={} literature={}", settings.getMode(), literature.getName());

        List<EvidenceCollector<?>> collectors = List.of(
                literature,
                new ClinicalTrialsGovCollector(clinicalTrialsClient),
                new CuratedPatentCollector(),
                new RegulatoryCollector(referenceDataset),
                new CuratedMarketCollector());
        return new CollectorRegistry(collectors, settings::timeoutFor);
    }
}
