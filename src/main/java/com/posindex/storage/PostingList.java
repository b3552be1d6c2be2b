package com.posindex.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 带位置信息与跳表指针的倒排列表。
 *
 * @param docIds 严格递增文档ID数组
 * @param positions 与docIds同长度，每个文档内严格递增的位置数组
 * @param skips 跳表指针，起点与目标下标均严格递增
 */
public record PostingList(int[] docIds, int[][] positions, SkipPointer[] skips) {
    /**
     * 构造时执行校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (docIds == null || positions == null) {
            throw new IllegalArgumentException("docIds与positions不能为null");
        }
        if (docIds.length != positions.length) {
            throw new IllegalArgumentException("docIds与positions长度不一致: " + docIds.length + " vs " + positions.length);
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
            if (positions[index] == null) {
                throw new IllegalArgumentException("positions[" + index + "] 不能为null");
            }
            checkPositions(docIds[index], positions[index]);
        }
        skips = skips == null ? new SkipPointer[0] : Arrays.copyOf(skips, skips.length);
        for (int index = 0; index < skips.length; index++) {
            SkipPointer skip = skips[index];
            if (skip.toIndex() >= docIds.length) {
                throw new IllegalArgumentException("跳表目标越界: to=" + skip.toIndex() + ", size=" + docIds.length);
            }
            if (index > 0 && (skip.fromIndex() <= skips[index - 1].fromIndex()
                    || skip.toIndex() <= skips[index - 1].toIndex())) {
                throw new IllegalArgumentException("跳表起点与目标必须单调递增，位置=" + index);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        int[][] copied = new int[positions.length][];
        for (int index = 0; index < positions.length; index++) {
            copied[index] = Arrays.copyOf(positions[index], positions[index].length);
        }
        positions = copied;
    }

    /**
     * 由 Posting 序列构造，并附带跳表指针。
     */
    public static PostingList of(List<Posting> postings, SkipPointer[] skips) {
        int[] docIds = new int[postings.size()];
        int[][] positions = new int[postings.size()][];
        for (int index = 0; index < postings.size(); index++) {
            docIds[index] = postings.get(index).docId();
            positions[index] = postings.get(index).positions();
        }
        return new PostingList(docIds, positions, skips);
    }

    /**
     * 校验单文档位置数组非负且严格递增。
     */
    static void checkPositions(int docId, int[] positions) {
        for (int index = 0; index < positions.length; index++) {
            if (positions[index] < 0) {
                throw new IllegalArgumentException("位置不能为负数: docId=" + docId + ", value=" + positions[index]);
            }
            if (index > 0 && positions[index] <= positions[index - 1]) {
                throw new IllegalArgumentException("文档内位置必须严格递增: docId=" + docId + ", 位置=" + index);
            }
        }
    }

    /**
     * 返回倒排项数量，即文档频率。
     */
    public int size() {
        return docIds.length;
    }

    public int docFreq() {
        return docIds.length;
    }

    public boolean isEmpty() {
        return docIds.length == 0;
    }

    /**
     * 获取指定下标的文档ID。
     */
    public int docId(int index) {
        return docIds[index];
    }

    /**
     * 获取指定下标文档内的词频。
     */
    public int termFreq(int index) {
        return positions[index].length;
    }

    /**
     * 获取指定下标文档的位置数组副本。
     */
    public int[] positionsAt(int index) {
        return Arrays.copyOf(positions[index], positions[index].length);
    }

    /**
     * 二分查找文档ID所在下标，未命中返回负数。
     */
    public int indexOf(int docId) {
        return Arrays.binarySearch(docIds, docId);
    }

    /**
     * 查找指定文档的位置数组，未命中返回空数组。
     */
    public int[] positionsFor(int docId) {
        int index = indexOf(docId);
        return index < 0 ? new int[0] : positionsAt(index);
    }

    /**
     * 判断指定文档内是否在给定位置出现。
     */
    public boolean hasPosition(int index, int position) {
        return Arrays.binarySearch(positions[index], position) >= 0;
    }

    public Posting posting(int index) {
        return new Posting(docIds[index], positions[index]);
    }

    public List<Posting> postings() {
        List<Posting> result = new ArrayList<>(docIds.length);
        for (int index = 0; index < docIds.length; index++) {
            result.add(posting(index));
        }
        return result;
    }

    /**
     * 第 k 个跳表指针，不复制数组。
     */
    public SkipPointer skip(int k) {
        return skips[k];
    }

    public int skipCount() {
        return skips.length;
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[][] positions() {
        int[][] copied = new int[positions.length][];
        for (int index = 0; index < positions.length; index++) {
            copied[index] = Arrays.copyOf(positions[index], positions[index].length);
        }
        return copied;
    }

    @Override
    public SkipPointer[] skips() {
        return Arrays.copyOf(skips, skips.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(docIds, that.docIds)
            && Arrays.deepEquals(positions, that.positions)
            && Arrays.equals(skips, that.skips);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(docIds);
        result = 31 * result + Arrays.deepHashCode(positions);
        return 31 * result + Arrays.hashCode(skips);
    }

    @Override
    public String toString() {
        return "PostingList[docIds=" + Arrays.toString(docIds) + ", skips=" + skips.length + "]";
    }
}
