package com.repurpose.analysis.model.evidence;

import com.repurpose.analysis.model.CollectorId;

import java.util.ArrayList;
import java.util.List;

public class TrialsEvidence extends CategoryEvidence {
    private List<Trial> trials = new ArrayList<>();

    public TrialsEvidence() {}

    public TrialsEvidence(List<Trial> trials, String dataSource) {
        super(true, dataSource);
        this.trials = trials == null ? new ArrayList<>() : new ArrayList<>(trials);
    }

    public static TrialsEvidence neutral() {
        TrialsEvidence e = new TrialsEvidence();
        e.setRetrieved(false);
        e.setDataSource("unavailable");
        return e;
    }

    @Override
    public CollectorId collectorId() { return CollectorId.TRIALS; }

    public List<Trial> getTrials() { return trials; }
    public void setTrials(List<Trial> trials) { this.trials = trials; }

    public int getTotalTrialsFound() { return trials == null ? 0 : trials.size(); }

    public static class Trial {
        private String id;
        private String title;
        /** Registry status, e.g. RECRUITING, ACTIVE_NOT_RECRUITING, COMPLETED */
        private String status;
        /** Registry phase label, e.g. PHASE2, "Phase 3", PHASE2/PHASE3 */
        private String phase;
        private int participants;
        private String completionDate;
        private String url;

        public Trial() {}

        public Trial(String id, String title, String status, String phase) {
            this.id = id;
            this.title = title;
            this.status = status;
            this.phase = phase;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public String getPhase() { return phase; }
        public void setPhase(String phase) { this.phase = phase; }
        public int getParticipants() { return participants; }
        public void setParticipants(int participants) { this.participants = participants; }
        public String getCompletionDate() { return completionDate; }
        public void setCompletionDate(String completionDate) { this.completionDate = completionDate; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
