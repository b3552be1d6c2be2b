package com.posindex.storage;

/**
 * 词典词条，记录词项对应倒排记录在倒排文件中的字节区间。
 *
 * @param term 词项
 * @param offset 倒排记录起始字节偏移
 * @param length 倒排记录字节长度
 */
public record DictionaryEntry(String term, long offset, long length) {
    public DictionaryEntry {
        if (term == null) {
            throw new IllegalArgumentException("term 不能为null");
        }
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("offset/length 不能为负数: term=" + term + ", offset=" + offset + ", length=" + length);
        }
    }

    /**
     * 下一个词条应当开始的偏移。
     */
    public long end() {
        return offset + length;
    }
}
