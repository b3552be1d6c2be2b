package com.posindex.query;

import java.util.List;

/**
 * 布尔查询语法树。
 */
public sealed interface QueryNode permits QueryNode.TermQuery, QueryNode.PhraseQuery,
        QueryNode.BooleanQuery, QueryNode.NotQuery {

    /** 二元布尔操作 */
    enum BoolOp {
        AND,
        OR
    }

    record TermQuery(String term) implements QueryNode {
        public TermQuery {
            if (term == null || term.isBlank()) {
                throw new IllegalArgumentException("词项不能为空");
            }
        }
    }

    record PhraseQuery(List<String> terms) implements QueryNode {
        public PhraseQuery {
            terms = List.copyOf(terms);
        }
    }

    record BooleanQuery(BoolOp op, QueryNode left, QueryNode right) implements QueryNode {
    }

    record NotQuery(QueryNode child) implements QueryNode {
    }

    static QueryNode term(String term) {
        return new TermQuery(term);
    }

    static QueryNode and(QueryNode left, QueryNode right) {
        return new BooleanQuery(BoolOp.AND, left, right);
    }

    static QueryNode or(QueryNode left, QueryNode right) {
        return new BooleanQuery(BoolOp.OR, left, right);
    }

    static QueryNode not(QueryNode child) {
        return new NotQuery(child);
    }
}
