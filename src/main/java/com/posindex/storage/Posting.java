package com.posindex.storage;

import java.util.Arrays;

/**
 * 单个文档中的词项出现记录。
 *
 * @param docId 文档内部编号
 * @param positions 严格递增的位置数组
 */
public record Posting(int docId, int[] positions) {
    public Posting {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (positions == null) {
            throw new IllegalArgumentException("positions不能为null");
        }
        PostingList.checkPositions(docId, positions);
        positions = Arrays.copyOf(positions, positions.length);
    }

    public int termFreq() {
        return positions.length;
    }

    @Override
    public int[] positions() {
        return Arrays.copyOf(positions, positions.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Posting that)) {
            return false;
        }
        return docId == that.docId && Arrays.equals(positions, that.positions);
    }

    @Override
    public int hashCode() {
        return 31 * docId + Arrays.hashCode(positions);
    }

    @Override
    public String toString() {
        return "Posting[docId=" + docId + ", positions=" + Arrays.toString(positions) + "]";
    }
}
