package com.posindex.query;

import com.posindex.index.IndexBuilder;
import com.posindex.index.SkipStrategy;
import com.posindex.storage.PostingList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Random;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 有序文档ID归并测试。
 */
class PostingMergerTest {

    @Test
    void mergesSmallLists() {
        int[] left = {1, 3, 5, 7};
        int[] right = {3, 4, 7, 9};

        assertArrayEquals(new int[]{3, 7}, PostingMerger.intersect(left, right));
        assertArrayEquals(new int[]{1, 3, 4, 5, 7, 9}, PostingMerger.union(left, right));
        assertArrayEquals(new int[]{1, 5}, PostingMerger.difference(left, right));
        assertArrayEquals(new int[]{4, 9}, PostingMerger.difference(right, left));
    }

    @Test
    void emptyOperands() {
        int[] values = {2, 4};
        assertArrayEquals(new int[0], PostingMerger.intersect(values, new int[0]));
        assertArrayEquals(values, PostingMerger.union(new int[0], values));
        assertArrayEquals(values, PostingMerger.difference(values, new int[0]));
        assertArrayEquals(new int[0], PostingMerger.difference(new int[0], values));
    }

    @Test
    void inputsAreNotModified() {
        int[] left = {1, 2, 3};
        int[] right = {2};
        PostingMerger.difference(left, right);
        PostingMerger.union(left, right);
        assertArrayEquals(new int[]{1, 2, 3}, left);
        assertArrayEquals(new int[]{2}, right);
    }

    @Test
    @DisplayName("随机序列的归并结果与集合运算一致")
    void randomMergesMatchSetSemantics() {
        Random random = new Random(20240301L);
        for (int round = 0; round < 200; round++) {
            TreeSet<Integer> left = randomSet(random, random.nextInt(60), 150);
            TreeSet<Integer> right = randomSet(random, random.nextInt(60), 150);

            TreeSet<Integer> intersection = new TreeSet<>(left);
            intersection.retainAll(right);
            TreeSet<Integer> union = new TreeSet<>(left);
            union.addAll(right);
            TreeSet<Integer> difference = new TreeSet<>(left);
            difference.removeAll(right);

            assertArrayEquals(toArray(intersection), PostingMerger.intersect(toArray(left), toArray(right)));
            assertArrayEquals(toArray(union), PostingMerger.union(toArray(left), toArray(right)));
            assertArrayEquals(toArray(difference), PostingMerger.difference(toArray(left), toArray(right)));
        }
    }

    @ParameterizedTest
    @EnumSource(SkipStrategy.class)
    @DisplayName("跳表求交与普通求交结果一致")
    void skipIntersectionMatchesPlainIntersection(SkipStrategy strategy) {
        Random random = new Random(strategy.ordinal() * 31L + 7);
        for (int round = 0; round < 100; round++) {
            int[] left = toArray(randomSet(random, random.nextInt(400), 2000));
            int[] right = toArray(randomSet(random, random.nextInt(400), 2000));

            int[] expected = PostingMerger.intersect(left, right);
            int[] actual = PostingMerger.intersectWithSkips(withSkips(left, strategy), withSkips(right, strategy));

            assertArrayEquals(expected, actual);
        }
    }

    @Test
    void skipIntersectionOnDenseAndSparseLists() {
        int[] dense = new int[100];
        for (int index = 0; index < dense.length; index++) {
            dense[index] = index;
        }
        int[] sparse = {5, 55, 99};

        int[] result = PostingMerger.intersectWithSkips(withSkips(dense, SkipStrategy.SQRT), withSkips(sparse, SkipStrategy.SQRT));

        assertArrayEquals(sparse, result);
        assertEquals(9, withSkips(dense, SkipStrategy.SQRT).skipCount());
    }

    @ParameterizedTest
    @EnumSource(SkipStrategy.class)
    @DisplayName("中间结果与带跳表倒排列表求交与普通求交结果一致")
    void oneSidedSkipIntersectionMatchesPlainIntersection(SkipStrategy strategy) {
        Random random = new Random(strategy.ordinal() * 17L + 3);
        for (int round = 0; round < 100; round++) {
            int[] candidates = toArray(randomSet(random, random.nextInt(50), 2000));
            int[] postings = toArray(randomSet(random, random.nextInt(400), 2000));

            assertArrayEquals(PostingMerger.intersect(candidates, postings),
                PostingMerger.intersectWithSkips(candidates, withSkips(postings, strategy)));
        }
    }

    @Test
    @DisplayName("游标沿跳表指针前进，不逐项扫描")
    void cursorFollowsSkipPointers() {
        int[] dense = new int[100];
        for (int index = 0; index < dense.length; index++) {
            dense[index] = index;
        }
        PostingMerger.SkipCursor cursor = new PostingMerger.SkipCursor(withSkips(dense, SkipStrategy.SQRT));

        int steps = 0;
        while (cursor.docId() < 55) {
            cursor.advanceTowards(55);
            steps++;
        }

        assertEquals(55, cursor.docId());
        assertEquals(5, cursor.skipsTaken());
        assertEquals(10, steps);
    }

    private static PostingList withSkips(int[] docIds, SkipStrategy strategy) {
        int[][] positions = new int[docIds.length][];
        for (int index = 0; index < docIds.length; index++) {
            positions[index] = new int[]{0};
        }
        return new PostingList(docIds, positions, IndexBuilder.buildSkips(docIds.length, strategy));
    }

    private static TreeSet<Integer> randomSet(Random random, int size, int bound) {
        TreeSet<Integer> values = new TreeSet<>();
        for (int index = 0; index < size; index++) {
            values.add(random.nextInt(bound));
        }
        return values;
    }

    private static int[] toArray(TreeSet<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
