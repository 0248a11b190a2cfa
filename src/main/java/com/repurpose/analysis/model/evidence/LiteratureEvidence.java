package com.repurpose.analysis.model.evidence;

import com.repurpose.analysis.model.CollectorId;

import java.util.ArrayList;
import java.util.List;

/**
 * Papers found for the subject/condition pair, in the order the source ranked them.
 */
public class LiteratureEvidence extends CategoryEvidence {
    private List<Paper> papers = new ArrayList<>();
    private String searchQuery;

    public LiteratureEvidence() {}

    public LiteratureEvidence(List<Paper> papers, String searchQuery, String dataSource) {
        super(true, dataSource);
        this.papers = papers == null ? new ArrayList<>() : new ArrayList<>(papers);
        this.searchQuery = searchQuery;
    }

    public static LiteratureEvidence neutral() {
        LiteratureEvidence e = new LiteratureEvidence();
        e.setRetrieved(false);
        e.setDataSource("unavailable");
        return e;
    }

    @Override
    public CollectorId collectorId() { return CollectorId.LITERATURE; }

    public List<Paper> getPapers() { return papers; }
    public void setPapers(List<Paper> papers) { this.papers = papers; }
    public String getSearchQuery() { return searchQuery; }
    public void setSearchQuery(String searchQuery) { this.searchQuery = searchQuery; }

    public int getTotalPapersFound() { return papers == null ? 0 : papers.size(); }

    public static class Paper {
        private String title;
        private String authors;
        private String venue;
        private int year;
        /** 0-100 */
        private int relevance;
        private String summary;
        private String pmid;
        private String url;

        public Paper() {}

        public Paper(String title, String authors, String venue, int year, int relevance, String summary) {
            this.title = title;
            this.authors = authors;
            this.venue = venue;
            this.year = year;
            this.relevance = relevance;
            this.summary = summary;
        }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getAuthors() { return authors; }
        public void setAuthors(String authors) { this.authors = authors; }
        public String getVenue() { return venue; }
        public void setVenue(String venue) { this.venue = venue; }
        public int getYear() { return year; }
        public void setYear(int year) { this.year = year; }
        public int getRelevance() { return relevance; }
        public void setRelevance(int relevance) { this.relevance = relevance; }
        public String getSummary() { return summary; }
        public void setSummary(String summary) { this.summary = summary; }
        public String getPmid() { return pmid; }
        public void setPmid(String pmid) { this.pmid = pmid; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
