package com.posindex.index;

import com.posindex.document.DocumentTable;
import com.posindex.storage.PostingList;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 只读位置倒排索引：词项 → 倒排列表，加文档表。
 *
 * 由 {@link IndexBuilder} 或 {@link com.posindex.storage.IndexDirectory#load} 创建，之后不再变化，可被多个查询线程共享。
 */
public final class InvertedIndex {
    private final SortedMap<String, PostingList> postingsByTerm;
    private final DocumentTable documentTable;
    private final SkipStrategy skipStrategy;

    public InvertedIndex(Map<String, PostingList> postingsByTerm, DocumentTable documentTable, SkipStrategy skipStrategy) {
        if (postingsByTerm == null || documentTable == null || skipStrategy == null) {
            throw new IllegalArgumentException("倒排表、文档表与跳表策略不能为null");
        }
        for (Map.Entry<String, PostingList> entry : postingsByTerm.entrySet()) {
            PostingList postingList = entry.getValue();
            if (postingList.isEmpty()) {
                throw new IllegalArgumentException("倒排列表不能为空: term=" + entry.getKey());
            }
            int lastDocId = postingList.docId(postingList.size() - 1);
            if (lastDocId >= documentTable.size()) {
                throw new IllegalArgumentException("倒排引用了不存在的文档: term=" + entry.getKey() + ", docId=" + lastDocId);
            }
        }
        this.postingsByTerm = Collections.unmodifiableSortedMap(new TreeMap<>(postingsByTerm));
        this.documentTable = documentTable;
        this.skipStrategy = skipStrategy;
    }

    /**
     * 查找词项的倒排列表。
     *
     * @param term 词项
     * @return 倒排列表，词项不存在时为空
     */
    public Optional<PostingList> postings(String term) {
        return Optional.ofNullable(postingsByTerm.get(term));
    }

    public boolean contains(String term) {
        return postingsByTerm.containsKey(term);
    }

    /**
     * 词项的文档频率，未知词项为 0。
     */
    public int docFreq(String term) {
        PostingList postingList = postingsByTerm.get(term);
        return postingList == null ? 0 : postingList.docFreq();
    }

    /**
     * 全部词项，按词序。
     */
    public List<String> terms() {
        return List.copyOf(postingsByTerm.keySet());
    }

    /**
     * 词项 → 倒排列表的只读视图，按词序。
     */
    public SortedMap<String, PostingList> postingsByTerm() {
        return postingsByTerm;
    }

    public int termCount() {
        return postingsByTerm.size();
    }

    public DocumentTable documents() {
        return documentTable;
    }

    public int documentCount() {
        return documentTable.size();
    }

    public SkipStrategy skipStrategy() {
        return skipStrategy;
    }
}
