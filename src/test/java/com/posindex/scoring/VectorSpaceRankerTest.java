package com.posindex.scoring;

import com.posindex.config.Constants;
import com.posindex.config.EngineConfig;
import com.posindex.document.InMemoryDocumentSource;
import com.posindex.document.TokenizedDocument;
import com.posindex.index.IndexBuilder;
import com.posindex.index.InvertedIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 向量空间排序测试。
 */
class VectorSpaceRankerTest {

    private static final double DELTA = 1e-4;

    private static VectorSpaceRanker ranker(Map<String, String> texts) throws IOException {
        InvertedIndex index = IndexBuilder.build(InMemoryDocumentSource.fromText(texts), EngineConfig.defaults()).index();
        return new VectorSpaceRanker(index);
    }

    private static Map<String, String> corpus() {
        return Map.of(
            "D1", "new york meetup group",
            "D2", "new york tech workshop",
            "D3", "python workshop");
    }

    @Test
    void weightFormulas() {
        assertEquals(1.0, TfIdfWeights.tf(3, 3), DELTA);
        assertEquals(1 + Math.log10(0.25), TfIdfWeights.tf(1, 4), DELTA);
        assertTrue(TfIdfWeights.tf(1, 20) < 0, "词频低于长度十分之一时 tf 为负");
        assertEquals(0.0, TfIdfWeights.tf(0, 4));
        assertEquals(Math.log10(3), TfIdfWeights.idf(3, 1), DELTA);
        assertEquals(0.0, TfIdfWeights.idf(3, 3));
        assertEquals(0.0, TfIdfWeights.idf(3, 0));
    }

    @Test
    @DisplayName("较短文档中的同一词项得分更高")
    void shorterDocumentRanksFirst() throws IOException {
        List<RankedHit> hits = ranker(corpus()).rank(List.of("workshop"), 10);

        assertEquals(List.of("D3", "D2"), hits.stream().map(RankedHit::docId).toList());
        assertEquals(0.346241, hits.get(0).score(), DELTA);
        assertEquals(0.310963, hits.get(1).score(), DELTA);
    }

    @Test
    void equalScoresAreOrderedByDocumentId() throws IOException {
        List<RankedHit> hits = ranker(Map.of(
            "b", "cat dog",
            "a", "cat dog",
            "c", "fish bird")).rank(List.of("cat"), 10);

        assertEquals(List.of("a", "b"), hits.stream().map(RankedHit::docId).toList());
        assertEquals(hits.get(0).score(), hits.get(1).score());
    }

    @Test
    @DisplayName("出现在所有文档中的词项不参与排序")
    void termInEveryDocumentScoresNothing() throws IOException {
        VectorSpaceRanker ranker = ranker(Map.of(
            "a", "common alpha",
            "b", "common beta"));

        assertTrue(ranker.rank(List.of("common"), 10).isEmpty());
        assertEquals(List.of("a"), ranker.rank(List.of("common", "alpha"), 10).stream().map(RankedHit::docId).toList());
    }

    @Test
    void unknownTermsAndInvalidLimits() throws IOException {
        VectorSpaceRanker ranker = ranker(corpus());

        assertTrue(ranker.rank(List.of("zebra"), 10).isEmpty());
        assertTrue(ranker.rank(List.of(), 10).isEmpty());
        assertTrue(ranker.rank(List.of("workshop"), 0).isEmpty());
        assertEquals(1, ranker.rank(List.of("workshop"), 1).size());
        assertEquals(2, ranker.rank(List.of("workshop"), Constants.MAX_TOP_N + 1).size());
    }

    @Test
    @DisplayName("空文档不计入文档总数")
    void emptyDocumentsAreExcludedFromCollectionSize() {
        IndexBuilder builder = new IndexBuilder();
        builder.addDocument(TokenizedDocument.ofText("a", "alpha beta"));
        builder.addDocument(TokenizedDocument.ofText("b", "beta gamma"));
        builder.addDocument(TokenizedDocument.ofText("empty", ""));
        VectorSpaceRanker ranker = new VectorSpaceRanker(builder.build().index());

        assertEquals(2, ranker.totalDocs());
        assertTrue(ranker.rank(List.of("beta"), 10).isEmpty());
        assertEquals(0.0, ranker.similarity("empty", List.of("alpha")));
    }

    @Test
    void scoresStayWithinUnitInterval() throws IOException {
        VectorSpaceRanker ranker = ranker(corpus());
        for (List<String> query : List.of(List.of("new", "york"), List.of("python", "tech", "group"),
                List.of("workshop", "meetup", "meetup"))) {
            for (RankedHit hit : ranker.rank(query, 10)) {
                assertTrue(hit.score() > 0 && hit.score() <= 1 + 1e-12, query + " -> " + hit);
            }
        }
    }

    @Test
    void similarityMatchesRankScore() throws IOException {
        VectorSpaceRanker ranker = ranker(corpus());
        List<String> query = List.of("new", "workshop", "workshop");

        for (RankedHit hit : ranker.rank(query, 10)) {
            assertEquals(hit.score(), ranker.similarity(hit.docId(), query), 1e-12);
        }
        assertEquals(0.0, ranker.similarity("missing", query));
    }

    @Test
    void documentVectorAndTopTerms() throws IOException {
        VectorSpaceRanker ranker = ranker(corpus());

        Map<String, Double> vector = ranker.documentVector("D2");
        assertEquals(List.of("new", "tech", "workshop", "york"), List.copyOf(vector.keySet()));
        assertEquals(List.of("tech"), ranker.topTerms("D2", 1));
        assertEquals(List.of("python", "workshop"), ranker.topTerms("D3", 5));
        assertTrue(ranker.documentVector("missing").isEmpty());
        assertTrue(ranker.topTerms("D1", 0).isEmpty());
    }

    @Test
    void queryVectorSkipsUnknownTerms() throws IOException {
        Map<String, Double> vector = ranker(corpus()).queryVector(List.of("python", "zebra"));

        assertEquals(List.of("python"), List.copyOf(vector.keySet()));
        assertEquals((1 + Math.log10(0.5)) * Math.log10(3), vector.get("python"), DELTA);
    }
}
