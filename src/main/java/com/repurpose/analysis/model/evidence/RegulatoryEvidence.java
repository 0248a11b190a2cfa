package com.repurpose.analysis.model.evidence;

import com.repurpose.analysis.model.CollectorId;

import java.util.ArrayList;
import java.util.List;

/**
 * Approval status of the subject for any indication, plus the pathway a new indication would take.
 */
public class RegulatoryEvidence extends CategoryEvidence {
    /** Approved for any indication, not necessarily the target condition. */
    private boolean approved;
    private String approvedIndication;
    private String approvalDate;
    private String applicationNumber;
    private String pathway = "Not established";
    private String pathwayDescription;
    private String timeline;
    private String estimatedCost;
    private boolean requiresInd;
    private String classification;
    private List<String> manufacturers = new ArrayList<>();

    public RegulatoryEvidence() {}

    public static RegulatoryEvidence neutral() {
        RegulatoryEvidence e = new RegulatoryEvidence();
        e.setRetrieved(false);
        e.setDataSource("unavailable");
        return e;
    }

    @Override
    public CollectorId collectorId() { return CollectorId.REGULATORY; }

    /** True when the pathway is an abbreviated one such as 505(b)(2). */
    public boolean isAbbreviatedPathway() {
        return pathway != null && pathway.contains("505(b)(2)");
    }

    public boolean isApproved() { return approved; }
    public void setApproved(boolean approved) { this.approved = approved; }
    public String getApprovedIndication() { return approvedIndication; }
    public void setApprovedIndication(String approvedIndication) { this.approvedIndication = approvedIndication; }
    public String getApprovalDate() { return approvalDate; }
    public void setApprovalDate(String approvalDate) { this.approvalDate = approvalDate; }
    public String getApplicationNumber() { return applicationNumber; }
    public void setApplicationNumber(String applicationNumber) { this.applicationNumber = applicationNumber; }
    public String getPathway() { return pathway; }
    public void setPathway(String pathway) { this.pathway = pathway; }
    public String getPathwayDescription() { return pathwayDescription; }
    public void setPathwayDescription(String pathwayDescription) { this.pathwayDescription = pathwayDescription; }
    public String getTimeline() { return timeline; }
    public void setTimeline(String timeline) { this.timeline = timeline; }
    public String getEstimatedCost() { return estimatedCost; }
    public void setEstimatedCost(String estimatedCost) { this.estimatedCost = estimatedCost; }
    public boolean isRequiresInd() { return requiresInd; }
    public void setRequiresInd(boolean requiresInd) { this.requiresInd = requiresInd; }
    public String getClassification() { return classification; }
    public void setClassification(String classification) { this.classification = classification; }
    public List<String> getManufacturers() { return manufacturers; }
    public void setManufacturers(List<String> manufacturers) { this.manufacturers = manufacturers; }
}
