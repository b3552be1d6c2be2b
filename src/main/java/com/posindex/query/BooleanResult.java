package com.posindex.query;

import java.util.List;
import java.util.Set;

/**
 * 布尔查询结果。
 *
 * @param docIds 命中文档外部标识，升序
 * @param missingTerms 词典中不存在的查询词项，用于区分“词项不存在”与“没有命中”
 */
public record BooleanResult(List<String> docIds, Set<String> missingTerms) {
    public BooleanResult {
        docIds = docIds == null ? List.of() : List.copyOf(docIds);
        missingTerms = missingTerms == null ? Set.of() : Set.copyOf(missingTerms);
    }

    public boolean hasMissingTerms() {
        return !missingTerms.isEmpty();
    }

    public boolean isEmpty() {
        return docIds.isEmpty();
    }

    public int size() {
        return docIds.size();
    }
}
