package com.repurpose.analysis.model.evidence;

import com.repurpose.analysis.model.CollectorId;

public class MarketEvidence extends CategoryEvidence {
    /** Free text such as "$4.2B" or "$2-10B". */
    private String marketSize = "To be determined";
    private String growthRate;
    private String competition = "Assessment needed";
    private String unmetNeed;
    private String patientPopulation;
    private String timeline;
    private String exclusivity;

    public MarketEvidence() {}

    public MarketEvidence(String marketSize, String growthRate, String competition, String unmetNeed, String patientPopulation) {
        super(true, "Market analysis");
        this.marketSize = marketSize;
        this.growthRate = growthRate;
        this.competition = competition;
        this.unmetNeed = unmetNeed;
        this.patientPopulation = patientPopulation;
    }

    public static MarketEvidence neutral() {
        MarketEvidence e = new MarketEvidence();
        e.setRetrieved(false);
        e.setDataSource("unavailable");
        return e;
    }

    @Override
    public CollectorId collectorId() { return CollectorId.MARKET; }

    public String getMarketSize() { return marketSize; }
    public void setMarketSize(String marketSize) { this.marketSize = marketSize; }
    public String getGrowthRate() { return growthRate; }
    public void setGrowthRate(String growthRate) { this.growthRate = growthRate; }
    public String getCompetition() { return competition; }
    public void setCompetition(String competition) { this.competition = competition; }
    public String getUnmetNeed() { return unmetNeed; }
    public void setUnmetNeed(String unmetNeed) { this.unmetNeed = unmetNeed; }
    public String getPatientPopulation() { return patientPopulation; }
    public void setPatientPopulation(String patientPopulation) { this.patientPopulation = patientPopulation; }
    public String getTimeline() { return timeline; }
    public void setTimeline(String timeline) { this.timeline = timeline; }
    public String getExclusivity() { return exclusivity; }
    public void setExclusivity(String exclusivity) { this.exclusivity = exclusivity; }
}
