package com.posindex.document;

/**
 * 文档元数据：内部编号、外部标识与词项总数。
 */
public record DocumentInfo(int docId, String externalId, int length) {
}
