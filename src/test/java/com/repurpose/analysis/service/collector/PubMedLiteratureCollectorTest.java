package com.repurpose.analysis.service.collector;

import com.repurpose.analysis.model.evidence.LiteratureEvidence.Paper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PubMedLiteratureCollectorTest {

    private static final String SEARCH_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <eSearchResult>
              <Count>3</Count>
              <IdList>
                <Id>31234567</Id>
                <Id>29876543</Id>
                <Id>28765432</Id>
              </IdList>
            </eSearchResult>
            """;

    private static final String FETCH_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <PubmedArticleSet>
              <PubmedArticle>
                <MedlineCitation>
                  <PMID Version="1">31234567</PMID>
                  <Article>
                    <Journal>
                      <JournalIssue><PubDate><Year>2019</Year></PubDate></JournalIssue>
                      <Title>Human Reproduction Update</Title>
                    </Journal>
                    <ArticleTitle>Metformin repurposing for polycystic ovary syndrome</ArticleTitle>
                    <Abstract>
                      <AbstractText Label="BACKGROUND">We assessed efficacy in a clinical trial.</AbstractText>
                      <AbstractText Label="RESULTS">Ovulation improved.</AbstractText>
                    </Abstract>
                    <AuthorList>
                      <Author><LastName>Smith</LastName><ForeName>Jane</ForeName></Author>
                      <Author><LastName>Doe</LastName><ForeName>John</ForeName></Author>
                      <Author><LastName>Lee</LastName><ForeName>Ann</ForeName></Author>
                      <Author><LastName>Kim</LastName><ForeName>Min</ForeName></Author>
                    </AuthorList>
                  </Article>
                </MedlineCitation>
              </PubmedArticle>
              <PubmedArticle>
                <MedlineCitation>
                  <PMID Version="1">29876543</PMID>
                  <Article>
                    <Journal>
                      <JournalIssue><PubDate><MedlineDate>2017 Nov-Dec</MedlineDate></PubDate></JournalIssue>
                      <Title>Endocrine</Title>
                    </Journal>
                    <ArticleTitle>Insulin sensitizers overview</ArticleTitle>
                    <AuthorList>
                      <Author><LastName>Brown</LastName></Author>
                    </AuthorList>
                  </Article>
                </MedlineCitation>
              </PubmedArticle>
            </PubmedArticleSet>
            """;

    @Test
    public void parsesSearchIds() {
        assertEquals(List.of("31234567", "29876543", "28765432"), PubMedLiteratureCollector.parseSearchIds(SEARCH_XML));
    }

    @Test
    public void parsesArticles() {
        List<Paper> papers = PubMedLiteratureCollector.parseArticles(FETCH_XML);
        assertEquals(2, papers.size());

        Paper first = papers.get(0);
        assertEquals("Metformin repurposing for polycystic ovary syndrome", first.getTitle());
        assertEquals("J. Smith, J. Doe, A. Lee et al.", first.getAuthors());
        assertEquals("Human Reproduction Update", first.getVenue());
        assertEquals(2019, first.getYear());
        assertEquals("31234567", first.getPmid());
        assertEquals("https://pubmed.ncbi.nlm.nih.gov/31234567/", first.getUrl());
        assertEquals("We assessed efficacy in a clinical trial. Ovulation improved.", first.getSummary());
        // 50 + repurposing 15 + efficacy 10 + clinical trial 15
        assertEquals(90, first.getRelevance());

        Paper second = papers.get(1);
        assertEquals("Brown", second.getAuthors());
        assertEquals(2017, second.getYear());
        assertEquals("Abstract not available", second.getSummary());
        assertEquals(50, second.getRelevance());
    }

    @Test
    public void relevanceIsClamped() {
        String all = "repurposing repurpose indication efficacy clinical trial mechanism therapy";
        assertEquals(100, PubMedLiteratureCollector.relevance(all, ""));
        assertEquals(50, PubMedLiteratureCollector.relevance("", null));
    }

    @Test
    public void queriesFallBackWithoutRepurposingTerm() {
        assertEquals(List.of("\"metformin\" AND \"PCOS\" AND repurposing", "\"metformin\" AND \"PCOS\""),
                PubMedLiteratureCollector.buildQueries("metformin", "PCOS"));
        assertEquals(List.of("\"PCOS\" AND repurposing"), PubMedLiteratureCollector.buildQueries("", "PCOS"));
        assertTrue(PubMedLiteratureCollector.buildQueries("", "").isEmpty());
    }
}
