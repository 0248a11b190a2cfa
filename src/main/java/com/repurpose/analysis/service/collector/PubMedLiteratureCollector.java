package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.evidence.LiteratureEvidence;
import com.repurpose.analysis.model.evidence.LiteratureEvidence.Paper;
import com.repurpose.analysis.util.TextMatch;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Literature evidence from PubMed E-utilities: esearch for PMIDs, then efetch for article details.
 * Both responses are XML and parsed with jsoup's XML parser.
 */
public class PubMedLiteratureCollector implements EvidenceCollector<LiteratureEvidence> {
    static final int SEARCH_RETMAX = 10;
    static final int FETCH_LIMIT = 5;
    private static final int SUMMARY_MAX = 500;

    private static final Map<String, Integer> RELEVANCE_KEYWORDS = new LinkedHashMap<>();
    static {
        RELEVANCE_KEYWORDS.put("repurposing", 15);
        RELEVANCE_KEYWORDS.put("repurpose", 15);
        RELEVANCE_KEYWORDS.put("indication", 10);
        RELEVANCE_KEYWORDS.put("efficacy", 10);
        RELEVANCE_KEYWORDS.put("clinical trial", 15);
        RELEVANCE_KEYWORDS.put("mechanism", 5);
        RELEVANCE_KEYWORDS.put("therapy", 5);
    }

    private final WebClient http;

    public PubMedLiteratureCollector(@Qualifier("pubmedClient") WebClient http) {
        this.http = http;
    }

    @Override
    public CollectorId id() {
        return CollectorId.LITERATURE;
    }

    @Override
    public Mono<LiteratureEvidence> collect(String subject, String condition) {
        List<String> queries = buildQueries(subject, condition);
        if (queries.isEmpty()) {
            return Mono.just(new LiteratureEvidence(List.of(), "", "PubMed"));
        }
        return searchWithFallback(queries, 0)
                .onErrorMap(WebClientException.class,
                        e -> new CollectorException(id(), "PubMed request failed: " + e.getMessage(), e));
    }

    private Mono<LiteratureEvidence> searchWithFallback(List<String> queries, int index) {
        String query = queries.get(index);
        return esearch(query).flatMap(pmids -> {
            if (pmids.isEmpty() && index + 1 < queries.size()) {
                return searchWithFallback(queries, index + 1);
            }
            if (pmids.isEmpty()) {
                return Mono.just(new LiteratureEvidence(List.of(), query, "PubMed"));
            }
            return efetch(pmids.subList(0, Math.min(FETCH_LIMIT, pmids.size())))
                    .map(papers -> new LiteratureEvidence(papers, query, "PubMed"));
        });
    }

    /**
     * The preferred query asks for repurposing papers on the pair; the fallback drops the
     * repurposing term. Single-term cases search the one term supplied.
     */
    static List<String> buildQueries(String subject, String condition) {
        String s = TextMatch.sanitizeQuery(subject);
        String c = TextMatch.sanitizeQuery(condition);
        List<String> out = new ArrayList<>();
        if (!s.isEmpty() && !c.isEmpty()) {
            out.add("\"" + s + "\" AND \"" + c + "\" AND repurposing");
            out.add("\"" + s + "\" AND \"" + c + "\"");
        } else if (!s.isEmpty()) {
            out.add("\"" + s + "\" AND repurposing");
            out.add("\"" + s + "\"");
        } else if (!c.isEmpty()) {
            out.add("\"" + c + "\" AND repurposing");
        }
        return out;
    }

    private Mono<List<String>> esearch(String term) {
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/esearch.fcgi")
                        .queryParam("db", "pubmed")
                        .queryParam("term", "{term}")
                        .queryParam("retmax", SEARCH_RETMAX)
                        .build(term))
                .retrieve()
                .bodyToMono(String.class)
                .map(PubMedLiteratureCollector::parseSearchIds)
                .defaultIfEmpty(List.of());
    }

    private Mono<List<Paper>> efetch(List<String> pmids) {
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/efetch.fcgi")
                        .queryParam("db", "pubmed")
                        .queryParam("id", String.join(",", pmids))
                        .queryParam("rettype", "xml")
                        .queryParam("retmode", "xml")
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .map(PubMedLiteratureCollector::parseArticles)
                .defaultIfEmpty(List.of());
    }

    static List<String> parseSearchIds(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        List<String> ids = new ArrayList<>();
        for (Element id : doc.select("IdList > Id")) {
            String text = id.text().trim();
            if (!text.isEmpty()) ids.add(text);
        }
        return ids;
    }

    static List<Paper> parseArticles(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        List<Paper> papers = new ArrayList<>();
        for (Element article : doc.select("PubmedArticle")) {
            papers.add(toPaper(article));
        }
        return papers;
    }

    private static Paper toPaper(Element article) {
        String title = textOr(article.selectFirst("ArticleTitle"), "Unknown Title");

        List<String> authors = new ArrayList<>();
        for (Element author : article.select("AuthorList > Author")) {
            String last = textOr(author.selectFirst("LastName"), "");
            String first = textOr(author.selectFirst("ForeName"), "");
            String name = last;
            if (!first.isEmpty()) {
                name = first.charAt(0) + ". " + last;
            }
            if (!name.isBlank()) authors.add(name.trim());
        }
        String authorLine = authors.isEmpty()
                ? "Unknown Authors"
                : String.join(", ", authors.subList(0, Math.min(3, authors.size()))) + (authors.size() > 3 ? " et al." : "");

        String journal = textOr(article.selectFirst("Journal > Title"), "Journal Unknown");
        int year = parseYear(article);
        String pmid = textOr(article.selectFirst("MedlineCitation > PMID"), textOr(article.selectFirst("PMID"), ""));

        StringBuilder abstractText = new StringBuilder();
        for (Element part : article.select("Abstract > AbstractText")) {
            if (abstractText.length() > 0) abstractText.append(' ');
            abstractText.append(part.text());
        }
        String summary = abstractText.length() == 0 ? "Abstract not available" : TextMatch.truncate(abstractText.toString(), SUMMARY_MAX);

        Paper paper = new Paper(title, authorLine, journal, year, relevance(title, abstractText.toString()), summary);
        paper.setPmid(pmid);
        paper.setUrl(pmid.isEmpty() ? "" : "https://pubmed.ncbi.nlm.nih.gov/" + pmid + "/");
        return paper;
    }

    private static int parseYear(Element article) {
        String year = textOr(article.selectFirst("PubDate > Year"), "");
        if (year.isEmpty()) {
            // MedlineDate looks like "2019 Nov-Dec"
            String medline = textOr(article.selectFirst("PubDate > MedlineDate"), "");
            year = medline.length() >= 4 ? medline.substring(0, 4) : "";
        }
        try {
            return year.isEmpty() ? 0 : Integer.parseInt(year);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Keyword heuristic over title and abstract, clamped to [40,100].
     */
    static int relevance(String title, String abstractText) {
        String text = ((title == null ? "" : title) + " " + (abstractText == null ? "" : abstractText)).toLowerCase(Locale.ROOT);
        int score = 50;
        for (Map.Entry<String, Integer> e : RELEVANCE_KEYWORDS.entrySet()) {
            if (text.contains(e.getKey())) score += e.getValue();
        }
        return Math.min(100, Math.max(40, score));
    }

    private static String textOr(Element e, String fallback) {
        if (e == null) return fallback;
        String t = e.text().trim();
        return t.isEmpty() ? fallback : t;
    }
}
