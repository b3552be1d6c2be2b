package com.posindex.index;

/**
 * 构建过程中被跳过的文档及原因。
 *
 * @param docId 文档外部标识
 * @param reason 可读原因
 */
public record DocumentError(String docId, String reason) {
}
