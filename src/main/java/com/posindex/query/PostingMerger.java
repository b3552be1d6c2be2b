package com.posindex.query;

import com.posindex.storage.PostingList;
import com.posindex.storage.SkipPointer;

import java.util.Arrays;

/**
 * 有序文档ID序列的双指针归并：交、并、差。
 *
 * 输入均为严格递增数组，结果总是新分配的数组，不修改输入。
 */
public final class PostingMerger {
    private PostingMerger() {
    }

    /**
     * 交集：落后的指针前进，相等时输出。
     */
    public static int[] intersect(int[] left, int[] right) {
        int[] result = new int[Math.min(left.length, right.length)];
        int size = 0;
        int i = 0;
        int j = 0;
        while (i < left.length && j < right.length) {
            if (left[i] == right[j]) {
                result[size++] = left[i];
                i++;
                j++;
            } else if (left[i] < right[j]) {
                i++;
            } else {
                j++;
            }
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * 利用两侧跳表指针的交集，结果与 {@link #intersect(int[], int[])} 完全一致。
     *
     * 游标位于跳表起点且目标文档ID不大于另一游标的文档ID时直接跳到目标，否则前进一步。
     */
    public static int[] intersectWithSkips(PostingList left, PostingList right) {
        SkipCursor leftCursor = new SkipCursor(left);
        SkipCursor rightCursor = new SkipCursor(right);
        int[] result = new int[Math.min(left.size(), right.size())];
        int size = 0;
        while (!leftCursor.exhausted() && !rightCursor.exhausted()) {
            int leftDoc = leftCursor.docId();
            int rightDoc = rightCursor.docId();
            if (leftDoc == rightDoc) {
                result[size++] = leftDoc;
                leftCursor.next();
                rightCursor.next();
            } else if (leftDoc < rightDoc) {
                leftCursor.advanceTowards(rightDoc);
            } else {
                rightCursor.advanceTowards(leftDoc);
            }
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * 中间结果与倒排列表求交，只有倒排列表一侧使用跳表。
     */
    public static int[] intersectWithSkips(int[] candidates, PostingList postings) {
        SkipCursor cursor = new SkipCursor(postings);
        int[] result = new int[Math.min(candidates.length, postings.size())];
        int size = 0;
        int i = 0;
        while (i < candidates.length && !cursor.exhausted()) {
            int docId = cursor.docId();
            if (candidates[i] == docId) {
                result[size++] = docId;
                i++;
                cursor.next();
            } else if (candidates[i] < docId) {
                i++;
            } else {
                cursor.advanceTowards(candidates[i]);
            }
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * 并集：输出较小值，相等时只输出一次，最后追加两侧剩余部分。
     */
    public static int[] union(int[] left, int[] right) {
        int[] result = new int[left.length + right.length];
        int size = 0;
        int i = 0;
        int j = 0;
        while (i < left.length && j < right.length) {
            if (left[i] == right[j]) {
                result[size++] = left[i];
                i++;
                j++;
            } else if (left[i] < right[j]) {
                result[size++] = left[i++];
            } else {
                result[size++] = right[j++];
            }
        }
        while (i < left.length) {
            result[size++] = left[i++];
        }
        while (j < right.length) {
            result[size++] = right[j++];
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * 差集 left NOT right。
     */
    public static int[] difference(int[] left, int[] right) {
        int[] result = new int[left.length];
        int size = 0;
        int i = 0;
        int j = 0;
        while (i < left.length && j < right.length) {
            if (left[i] == right[j]) {
                i++;
                j++;
            } else if (left[i] < right[j]) {
                result[size++] = left[i++];
            } else {
                j++;
            }
        }
        while (i < left.length) {
            result[size++] = left[i++];
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * 倒排列表上的游标，直接读取列表内部数据，跳表指针按起点顺序推进。
     */
    static final class SkipCursor {
        private final PostingList postings;
        private int index;
        private int nextSkip;
        private int skipsTaken;

        SkipCursor(PostingList postings) {
            this.postings = postings;
        }

        boolean exhausted() {
            return index >= postings.size();
        }

        int docId() {
            return postings.docId(index);
        }

        int index() {
            return index;
        }

        int skipsTaken() {
            return skipsTaken;
        }

        void next() {
            index++;
        }

        /**
         * 当前位置有跳表指针且目标文档ID不大于 bound 时跳转，否则前进一步。
         */
        void advanceTowards(int bound) {
            while (nextSkip < postings.skipCount() && postings.skip(nextSkip).fromIndex() < index) {
                nextSkip++;
            }
            if (nextSkip < postings.skipCount()) {
                SkipPointer skip = postings.skip(nextSkip);
                if (skip.fromIndex() == index && postings.docId(skip.toIndex()) <= bound) {
                    index = skip.toIndex();
                    skipsTaken++;
                    return;
                }
            }
            index++;
        }
    }
}
