package com.posindex.scoring;

/**
 * 排序结果中的一条命中。
 *
 * @param docId 文档外部标识
 * @param score 余弦相似度
 */
public record RankedHit(String docId, double score) {
}
