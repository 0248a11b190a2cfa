package com.repurpose.analysis.model.evidence;

import com.repurpose.analysis.model.CollectorId;

import java.util.ArrayList;
import java.util.List;

public class PatentEvidence extends CategoryEvidence {
    private List<Patent> patents = new ArrayList<>();

    public PatentEvidence() {}

    public PatentEvidence(List<Patent> patents, String dataSource) {
        super(true, dataSource);
        this.patents = patents == null ? new ArrayList<>() : new ArrayList<>(patents);
    }

    public static PatentEvidence neutral() {
        PatentEvidence e = new PatentEvidence();
        e.setRetrieved(false);
        e.setDataSource("unavailable");
        return e;
    }

    @Override
    public CollectorId collectorId() { return CollectorId.PATENTS; }

    public List<Patent> getPatents() { return patents; }
    public void setPatents(List<Patent> patents) { this.patents = patents; }

    public int getTotalPatentsFound() { return patents == null ? 0 : patents.size(); }

    public static class Patent {
        private String number;
        private String title;
        /** "Granted" or "Pending" */
        private String status;
        private String filingDate;
        private String assignee;
        private String url;

        public Patent() {}

        public Patent(String number, String title, String status, String filingDate, String assignee) {
            this.number = number;
            this.title = title;
            this.status = status;
            this.filingDate = filingDate;
            this.assignee = assignee;
            this.url = "https://patents.google.com/patent/" + number;
        }

        public boolean isGranted() { return "granted".equalsIgnoreCase(status); }

        public String getNumber() { return number; }
        public void setNumber(String number) { this.number = number; }
        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public String getFilingDate() { return filingDate; }
        public void setFilingDate(String filingDate) { this.filingDate = filingDate; }
        public String getAssignee() { return assignee; }
        public void setAssignee(String assignee) { this.assignee = assignee; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
