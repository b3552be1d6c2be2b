package com.posindex.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 基于内存映射的文档来源。
 */
public final class InMemoryDocumentSource implements DocumentSource {
    private final List<TokenizedDocument> documents;

    public InMemoryDocumentSource(List<TokenizedDocument> documents) {
        this.documents = documents == null ? List.of() : List.copyOf(documents);
    }

    /**
     * 由 文档标识 → 词项序列 映射构造，位置按词项下标分配。
     */
    public static InMemoryDocumentSource fromTerms(Map<String, List<String>> termsByDocId) {
        List<TokenizedDocument> documents = new ArrayList<>(termsByDocId.size());
        for (Map.Entry<String, List<String>> entry : termsByDocId.entrySet()) {
            documents.add(TokenizedDocument.of(entry.getKey(), entry.getValue()));
        }
        return new InMemoryDocumentSource(documents);
    }

    /**
     * 由 文档标识 → 规范化文本 映射构造。
     */
    public static InMemoryDocumentSource fromText(Map<String, String> textByDocId) {
        List<TokenizedDocument> documents = new ArrayList<>(textByDocId.size());
        for (Map.Entry<String, String> entry : textByDocId.entrySet()) {
            documents.add(TokenizedDocument.ofText(entry.getKey(), entry.getValue()));
        }
        return new InMemoryDocumentSource(documents);
    }

    @Override
    public List<TokenizedDocument> documents() {
        return documents;
    }
}
