package com.posindex.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 文档表：外部标识与内部编号的双向映射，并记录每个文档的词项总数。
 *
 * 内部编号按外部标识升序分配，因此内部编号的顺序与外部标识的顺序一致。
 */
public final class DocumentTable {
    private final List<DocumentInfo> documents;
    private final Map<String, Integer> docIdsByExternalId;

    private DocumentTable(List<DocumentInfo> documents) {
        this.documents = List.copyOf(documents);
        Map<String, Integer> index = new HashMap<>(documents.size() * 2);
        for (DocumentInfo document : documents) {
            index.put(document.externalId(), document.docId());
        }
        this.docIdsByExternalId = Collections.unmodifiableMap(index);
    }

    /**
     * 由 外部标识 → 词项总数 构造文档表。
     *
     * @param lengthsByExternalId 外部标识到长度的映射
     * @return 文档表
     */
    public static DocumentTable fromLengths(Map<String, Integer> lengthsByExternalId) {
        TreeMap<String, Integer> sorted = new TreeMap<>(lengthsByExternalId);
        List<DocumentInfo> documents = new ArrayList<>(sorted.size());
        int nextDocId = 0;
        for (Map.Entry<String, Integer> entry : sorted.entrySet()) {
            int length = entry.getValue() == null ? 0 : entry.getValue();
            if (length < 0) {
                throw new IllegalArgumentException("文档长度不能为负数: " + entry.getKey() + "=" + length);
            }
            documents.add(new DocumentInfo(nextDocId++, entry.getKey(), length));
        }
        return new DocumentTable(documents);
    }

    public Optional<DocumentInfo> findById(int docId) {
        if (docId < 0 || docId >= documents.size()) {
            return Optional.empty();
        }
        return Optional.of(documents.get(docId));
    }

    public Optional<DocumentInfo> findByExternalId(String externalId) {
        Integer docId = docIdsByExternalId.get(externalId);
        return docId == null ? Optional.empty() : Optional.of(documents.get(docId));
    }

    /**
     * 将内部编号转换为外部标识。
     *
     * @throws IllegalArgumentException 编号不存在时抛出
     */
    public String externalId(int docId) {
        return findById(docId)
            .orElseThrow(() -> new IllegalArgumentException("文档不存在: docId=" + docId))
            .externalId();
    }

    public int length(int docId) {
        return findById(docId).map(DocumentInfo::length).orElse(0);
    }

    /**
     * 批量转换内部编号为外部标识，保持输入顺序。
     */
    public List<String> externalIds(int[] docIds) {
        List<String> result = new ArrayList<>(docIds.length);
        for (int docId : docIds) {
            result.add(externalId(docId));
        }
        return result;
    }

    /**
     * 全部文档内部编号，升序。
     */
    public int[] allDocIds() {
        int[] docIds = new int[documents.size()];
        for (int index = 0; index < docIds.length; index++) {
            docIds[index] = index;
        }
        return docIds;
    }

    /**
     * 至少包含一个词项的文档数。
     */
    public int nonEmptyCount() {
        int count = 0;
        for (DocumentInfo document : documents) {
            if (document.length() > 0) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return documents.size();
    }

    public List<DocumentInfo> documents() {
        return documents;
    }

    /**
     * 外部标识到长度的有序映射，用于持久化。
     */
    public Map<String, Integer> lengthsByExternalId() {
        Map<String, Integer> lengths = new TreeMap<>();
        for (DocumentInfo document : documents) {
            lengths.put(document.externalId(), document.length());
        }
        return lengths;
    }
}
