package com.posindex.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 短语查询结果：命中文档及其短语起始位置。
 */
public final class PhraseResult {
    private final Map<String, int[]> startPositions;
    private final int candidateCount;
    private final Set<String> missingTerms;

    /**
     * @param startPositions 文档外部标识 → 起始位置，按文档顺序
     * @param candidateCount 仅按词袋 AND 得到的候选文档数
     * @param missingTerms 词典中不存在的短语词项
     */
    public PhraseResult(Map<String, int[]> startPositions, int candidateCount, Set<String> missingTerms) {
        Map<String, int[]> copied = new LinkedHashMap<>();
        startPositions.forEach((docId, positions) -> copied.put(docId, Arrays.copyOf(positions, positions.length)));
        this.startPositions = Collections.unmodifiableMap(copied);
        this.candidateCount = candidateCount;
        this.missingTerms = Set.copyOf(missingTerms);
    }

    public static PhraseResult empty(Set<String> missingTerms) {
        return new PhraseResult(Map.of(), 0, missingTerms);
    }

    /**
     * 命中文档外部标识，按文档顺序。
     */
    public List<String> docIds() {
        return new ArrayList<>(startPositions.keySet());
    }

    /**
     * 指定文档中短语的起始位置，未命中返回空数组。
     */
    public int[] startPositions(String docId) {
        int[] positions = startPositions.get(docId);
        return positions == null ? new int[0] : Arrays.copyOf(positions, positions.length);
    }

    public int matchCount() {
        return startPositions.size();
    }

    /**
     * 全部命中文档中的短语出现次数。
     */
    public int occurrenceCount() {
        int total = 0;
        for (int[] positions : startPositions.values()) {
            total += positions.length;
        }
        return total;
    }

    public int candidateCount() {
        return candidateCount;
    }

    /**
     * 词袋 AND 命中但位置校验失败的文档数。
     */
    public int falsePositiveCount() {
        return candidateCount - startPositions.size();
    }

    public Set<String> missingTerms() {
        return missingTerms;
    }

    public boolean hasMissingTerms() {
        return !missingTerms.isEmpty();
    }

    public boolean isEmpty() {
        return startPositions.isEmpty();
    }

    @Override
    public String toString() {
        return "PhraseResult[matches=" + startPositions.keySet() + ", candidates=" + candidateCount
            + ", missing=" + missingTerms + "]";
    }
}
