package com.posindex.query;

import com.posindex.document.DocumentTable;
import com.posindex.index.InvertedIndex;
import com.posindex.storage.PostingList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 短语位置校验。
 *
 * 先对全部词项做不看位置的 AND 得到候选文档，再检查首词项的每个位置 p，
 * 第 i 个词项在 p + i 处出现则 p 为一个短语起点。
 */
public final class PhraseVerifier {
    private final InvertedIndex index;

    public PhraseVerifier(InvertedIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("索引不能为null");
        }
        this.index = index;
    }

    /**
     * 校验短语。
     *
     * @param terms 有序词项
     * @return 命中文档与起始位置
     */
    public PhraseResult verify(List<String> terms) {
        Set<String> missingTerms = new LinkedHashSet<>();
        Candidates candidates = match(terms, missingTerms);
        if (candidates == null) {
            return PhraseResult.empty(missingTerms);
        }
        DocumentTable documents = index.documents();
        Map<String, int[]> byExternalId = new LinkedHashMap<>();
        candidates.matches().forEach((docId, starts) -> byExternalId.put(documents.externalId(docId), starts));
        return new PhraseResult(byExternalId, candidates.candidateCount(), missingTerms);
    }

    /**
     * 候选文档数与按内部编号排列的命中结果。
     */
    record Candidates(int candidateCount, TreeMap<Integer, int[]> matches) {
    }

    /**
     * 按内部编号计算短语命中，短语为空或存在未知词项时返回 null。
     */
    Candidates match(List<String> terms, Set<String> missingTerms) {
        if (terms == null || terms.isEmpty()) {
            return null;
        }
        List<PostingList> lists = new ArrayList<>(terms.size());
        for (String term : terms) {
            Optional<PostingList> postingList = index.postings(term);
            if (postingList.isEmpty()) {
                missingTerms.add(term);
            } else {
                lists.add(postingList.get());
            }
        }
        if (!missingTerms.isEmpty()) {
            return null;
        }

        List<PostingList> byDocFreq = new ArrayList<>(lists);
        byDocFreq.sort(Comparator.comparingInt(PostingList::docFreq));
        int[] candidates = byDocFreq.get(0).docIds();
        for (int next = 1; next < byDocFreq.size() && candidates.length > 0; next++) {
            candidates = PostingMerger.intersect(candidates, byDocFreq.get(next).docIds());
        }

        TreeMap<Integer, int[]> matches = new TreeMap<>();
        for (int docId : candidates) {
            int[] starts = startPositions(lists, docId);
            if (starts.length > 0) {
                matches.put(docId, starts);
            }
        }
        return new Candidates(candidates.length, matches);
    }

    private int[] startPositions(List<PostingList> lists, int docId) {
        int[][] positions = new int[lists.size()][];
        for (int offset = 0; offset < lists.size(); offset++) {
            positions[offset] = lists.get(offset).positionsFor(docId);
        }
        int[] starts = new int[positions[0].length];
        int size = 0;
        for (int start : positions[0]) {
            boolean aligned = true;
            for (int offset = 1; offset < positions.length && aligned; offset++) {
                aligned = Arrays.binarySearch(positions[offset], start + offset) >= 0;
            }
            if (aligned) {
                starts[size++] = start;
            }
        }
        return Arrays.copyOf(starts, size);
    }
}
