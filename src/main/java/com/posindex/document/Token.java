package com.posindex.document;

/**
 * 规范化后的词项及其在文档内的位置（从0开始）。
 */
public record Token(
    String term,
    int position
) {
}
