package com.posindex.scoring;

/**
 * TF-IDF 权重公式。
 *
 * tf = 1 + log10(词频 / 文档长度)，idf = log10(文档总数 / 文档频率)。
 * 词频小于文档长度的十分之一时 tf 为负。
 */
public final class TfIdfWeights {
    private TfIdfWeights() {
    }

    public static double tf(int termFrequency, int length) {
        if (termFrequency <= 0 || length <= 0) {
            return 0.0;
        }
        return 1 + Math.log10((double) termFrequency / length);
    }

    public static double idf(int totalDocs, int docFrequency) {
        if (docFrequency <= 0 || totalDocs <= 0) {
            return 0.0;
        }
        return Math.log10((double) totalDocs / docFrequency);
    }

    public static double weight(int termFrequency, int length, int totalDocs, int docFrequency) {
        return tf(termFrequency, length) * idf(totalDocs, docFrequency);
    }
}
