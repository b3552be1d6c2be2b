package com.posindex.document;

import java.util.ArrayList;
import java.util.List;

/**
 * 外部分词组件产出的单个文档：文档标识与有序词项序列。
 *
 * @param docId 外部文档标识
 * @param tokens 按位置排列的词项
 */
public record TokenizedDocument(String docId, List<Token> tokens) {
    public TokenizedDocument {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("文档标识不能为空");
        }
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    /**
     * 按词项下标分配位置，构造文档。
     *
     * @param docId 外部文档标识
     * @param terms 规范化词项序列
     * @return 分词文档
     */
    public static TokenizedDocument of(String docId, List<String> terms) {
        if (terms == null) {
            return new TokenizedDocument(docId, List.of());
        }
        List<Token> tokens = new ArrayList<>(terms.size());
        for (int position = 0; position < terms.size(); position++) {
            tokens.add(new Token(terms.get(position), position));
        }
        return new TokenizedDocument(docId, tokens);
    }

    /**
     * 按空白切分已规范化文本构造文档。
     */
    public static TokenizedDocument ofText(String docId, String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return new TokenizedDocument(docId, List.of());
        }
        return of(docId, List.of(normalizedText.trim().split("\\s+")));
    }

    public int length() {
        return tokens.size();
    }
}
