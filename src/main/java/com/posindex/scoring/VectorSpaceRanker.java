package com.posindex.scoring;

import com.posindex.config.Constants;
import com.posindex.document.DocumentInfo;
import com.posindex.document.DocumentTable;
import com.posindex.index.InvertedIndex;
import com.posindex.storage.PostingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 向量空间模型排序：TF-IDF 权重与余弦相似度。
 *
 * 文档总数只统计至少含一个词项的文档。文档向量的模长在构造时按文档全部词项一次性计算，
 * 点积只在查询词项上累加。
 */
public final class VectorSpaceRanker {
    private static final Logger logger = LoggerFactory.getLogger(VectorSpaceRanker.class);
    private static final Comparator<RankedHit> BY_SCORE_THEN_DOC = Comparator
        .comparingDouble(RankedHit::score).reversed()
        .thenComparing(RankedHit::docId);

    private final InvertedIndex index;
    private final DocumentTable documents;
    private final int totalDocs;
    private final double[] documentNorms;

    public VectorSpaceRanker(InvertedIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("索引不能为null");
        }
        this.index = index;
        this.documents = index.documents();
        this.totalDocs = documents.nonEmptyCount();
        this.documentNorms = computeDocumentNorms();
    }

    private double[] computeDocumentNorms() {
        double[] squared = new double[documents.size()];
        for (PostingList postingList : index.postingsByTerm().values()) {
            double idf = TfIdfWeights.idf(totalDocs, postingList.docFreq());
            for (int position = 0; position < postingList.size(); position++) {
                int docId = postingList.docId(position);
                double weight = TfIdfWeights.tf(postingList.termFreq(position), documents.length(docId)) * idf;
                squared[docId] += weight * weight;
            }
        }
        double[] norms = new double[squared.length];
        for (int docId = 0; docId < squared.length; docId++) {
            norms[docId] = Math.sqrt(squared[docId]);
        }
        return norms;
    }

    /**
     * 对查询排序。
     *
     * @param queryTerms 已规范化的查询词项，可重复
     * @param topN 返回条数上限
     * @return 相似度大于 0 的命中，按相似度降序、文档标识升序
     */
    public List<RankedHit> rank(List<String> queryTerms, int topN) {
        if (queryTerms == null || queryTerms.isEmpty() || topN <= 0) {
            return List.of();
        }
        Map<String, Double> queryVector = queryVector(queryTerms);
        double queryNorm = norm(queryVector);
        if (queryNorm == 0.0) {
            logger.debug("查询向量为零: terms={}", queryTerms);
            return List.of();
        }

        Map<Integer, Double> dotProducts = new HashMap<>();
        for (Map.Entry<String, Double> entry : queryVector.entrySet()) {
            double queryWeight = entry.getValue();
            if (queryWeight == 0.0) {
                continue;
            }
            PostingList postingList = index.postings(entry.getKey()).orElseThrow();
            double idf = TfIdfWeights.idf(totalDocs, postingList.docFreq());
            for (int position = 0; position < postingList.size(); position++) {
                int docId = postingList.docId(position);
                double documentWeight = TfIdfWeights.tf(postingList.termFreq(position), documents.length(docId)) * idf;
                dotProducts.merge(docId, queryWeight * documentWeight, Double::sum);
            }
        }

        List<RankedHit> hits = new ArrayList<>();
        for (Map.Entry<Integer, Double> entry : dotProducts.entrySet()) {
            double documentNorm = documentNorms[entry.getKey()];
            if (documentNorm == 0.0) {
                continue;
            }
            double score = entry.getValue() / (documentNorm * queryNorm);
            if (score > 0) {
                hits.add(new RankedHit(documents.externalId(entry.getKey()), score));
            }
        }
        hits.sort(BY_SCORE_THEN_DOC);
        int limit = Math.min(topN, Constants.MAX_TOP_N);
        logger.debug("排序完成: matched={}, returned={}", hits.size(), Math.min(limit, hits.size()));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    /**
     * 单个文档与查询的余弦相似度，文档不存在或任一向量为零时为 0。
     */
    public double similarity(String docId, List<String> queryTerms) {
        Optional<DocumentInfo> document = documents.findByExternalId(docId);
        if (document.isEmpty() || queryTerms == null || queryTerms.isEmpty()) {
            return 0.0;
        }
        int internalId = document.get().docId();
        Map<String, Double> queryVector = queryVector(queryTerms);
        double queryNorm = norm(queryVector);
        double documentNorm = documentNorms[internalId];
        if (queryNorm == 0.0 || documentNorm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (Map.Entry<String, Double> entry : queryVector.entrySet()) {
            dot += entry.getValue() * documentWeight(entry.getKey(), internalId);
        }
        return dot / (documentNorm * queryNorm);
    }

    /**
     * 查询向量：只包含索引中存在的词项，tf 以查询长度为分母。
     */
    public Map<String, Double> queryVector(List<String> queryTerms) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String term : queryTerms) {
            counts.merge(term, 1, Integer::sum);
        }
        Map<String, Double> vector = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            int docFreq = index.docFreq(entry.getKey());
            if (docFreq > 0) {
                vector.put(entry.getKey(), TfIdfWeights.weight(entry.getValue(), queryTerms.size(), totalDocs, docFreq));
            }
        }
        return vector;
    }

    /**
     * 文档的完整 TF-IDF 向量，按词序；不缓存。
     */
    public Map<String, Double> documentVector(String docId) {
        Optional<DocumentInfo> document = documents.findByExternalId(docId);
        if (document.isEmpty()) {
            return Map.of();
        }
        int internalId = document.get().docId();
        Map<String, Double> vector = new TreeMap<>();
        for (Map.Entry<String, PostingList> entry : index.postingsByTerm().entrySet()) {
            if (entry.getValue().indexOf(internalId) >= 0) {
                vector.put(entry.getKey(), documentWeight(entry.getKey(), internalId));
            }
        }
        return vector;
    }

    /**
     * 文档中权重最高的 k 个词项。
     */
    public List<String> topTerms(String docId, int k) {
        if (k <= 0) {
            return List.of();
        }
        return documentVector(docId).entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .limit(k)
            .map(Map.Entry::getKey)
            .toList();
    }

    public int totalDocs() {
        return totalDocs;
    }

    private double documentWeight(String term, int docId) {
        Optional<PostingList> postingList = index.postings(term);
        if (postingList.isEmpty()) {
            return 0.0;
        }
        int position = postingList.get().indexOf(docId);
        if (position < 0) {
            return 0.0;
        }
        return TfIdfWeights.weight(postingList.get().termFreq(position), documents.length(docId),
            totalDocs, postingList.get().docFreq());
    }

    private static double norm(Map<String, Double> vector) {
        double sum = 0.0;
        for (double weight : vector.values()) {
            sum += weight * weight;
        }
        return Math.sqrt(sum);
    }
}
