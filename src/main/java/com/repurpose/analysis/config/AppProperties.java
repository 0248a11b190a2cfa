package com.repurpose.analysis.config;

import com.repurpose.analysis.model.CollectorId;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Location of the medicine reference dataset (CSV). Accepts Spring resource prefixes.
     */
    private String referenceDataset = "classpath:data/medicine_dataset.csv";
    private String pubmedBaseUrl = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    private String clinicalTrialsBaseUrl = "https://clinicaltrials.gov";
    /**
     * Upper bound on drug name / condition length accepted by the HTTP API.
     */
    private int maxInputLength = 200;
    private Collectors collectors = new Collectors();

    public String getReferenceDataset() {
        return referenceDataset;
    }

    public void setReferenceDataset(String referenceDataset) {
        this.referenceDataset = referenceDataset;
    }

    public String getPubmedBaseUrl() {
        return pubmedBaseUrl;
    }

    public void setPubmedBaseUrl(String pubmedBaseUrl) {
        this.pubmedBaseUrl = pubmedBaseUrl;
    }

    public String getClinicalTrialsBaseUrl() {
        return clinicalTrialsBaseUrl;
    }

    public void setClinicalTrialsBaseUrl(String clinicalTrialsBaseUrl) {
        this.clinicalTrialsBaseUrl = clinicalTrialsBaseUrl;
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }

    public void setMaxInputLength(int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    public Collectors getCollectors() {
        return collectors;
    }

    public void setCollectors(Collectors collectors) {
        this.collectors = collectors;
    }

    public static class Collectors {
        /**
         * "live" queries PubMed for literature; "offline" derives literature from the reference dataset.
         */
        private String mode = "live";
        /**
         * Per-collector time budgets keyed by category (literature, trials, patents, regulatory, market).
         */
        private Map<String, Duration> timeouts = defaultTimeouts();

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public boolean isOffline() {
            return "offline".equalsIgnoreCase(mode);
        }

        public Map<String, Duration> getTimeouts() {
            return timeouts;
        }

        public void setTimeouts(Map<String, Duration> timeouts) {
            this.timeouts = timeouts;
        }

        /** Budget for one collector; falls back to the built-in default when not configured. */
        public Duration timeoutFor(CollectorId id) {
            Duration d = timeouts == null ? null : timeouts.get(id.getCategory());
            return d != null && !d.isNegative() && !d.isZero() ? d : DEFAULT_TIMEOUTS.get(id);
        }

        private static Map<String, Duration> defaultTimeouts() {
            Map<String, Duration> m = new LinkedHashMap<>();
            DEFAULT_TIMEOUTS.forEach((id, d) -> m.put(id.getCategory(), d));
            return m;
        }
    }

    // Network-bound collectors get the larger budgets
    static final Map<CollectorId, Duration> DEFAULT_TIMEOUTS = new EnumMap<>(Map.of(
            CollectorId.LITERATURE, Duration.ofSeconds(20),
            CollectorId.TRIALS, Duration.ofSeconds(20),
            CollectorId.PATENTS, Duration.ofSeconds(20),
            CollectorId.REGULATORY, Duration.ofSeconds(15),
            CollectorId.MARKET, Duration.ofSeconds(15)
    ));
}
