package com.posindex.storage.dictionary;

import com.posindex.config.Constants;

import java.util.List;
import java.util.OptionalLong;

/**
 * 按块存储的一条记录：最多 4 个词项、块内首个词项的倒排偏移、前三个词项的倒排长度。
 *
 * 第四个词项的长度不在记录中，{@link #termLength(int)} 对其返回空值。
 *
 * @param terms 块内词项，不含空槽位
 * @param offset 首个词项的倒排偏移
 * @param auxLengths 前三个词项的倒排长度，不足时补 0
 */
public record DictionaryBlock(List<String> terms, long offset, List<Long> auxLengths) {
    public DictionaryBlock {
        if (terms == null || auxLengths == null) {
            throw new IllegalArgumentException("terms/auxLengths 不能为null");
        }
        if (terms.size() > Constants.BLOCKING_TERM_SLOTS) {
            throw new IllegalArgumentException("块内词项数超过槽位数: " + terms.size());
        }
        if (auxLengths.size() != Constants.BLOCKING_AUX_FIELDS) {
            throw new IllegalArgumentException("辅助长度字段数必须为 " + Constants.BLOCKING_AUX_FIELDS + ": " + auxLengths.size());
        }
        terms = List.copyOf(terms);
        auxLengths = List.copyOf(auxLengths);
    }

    public int termCount() {
        return terms.size();
    }

    /**
     * 按倒排区间首尾相接推导指定槽位词项的偏移。
     *
     * @param slot 槽位，0 起
     * @return 倒排偏移
     */
    public long termOffset(int slot) {
        checkSlot(slot);
        long derived = offset;
        for (int index = 0; index < slot; index++) {
            derived += auxLengths.get(index);
        }
        return derived;
    }

    /**
     * 指定槽位词项的倒排长度，第四个槽位没有存储长度。
     */
    public OptionalLong termLength(int slot) {
        checkSlot(slot);
        if (slot >= Constants.BLOCKING_AUX_FIELDS) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(auxLengths.get(slot));
    }

    private void checkSlot(int slot) {
        if (slot < 0 || slot >= terms.size()) {
            throw new IndexOutOfBoundsException("槽位越界: slot=" + slot + ", terms=" + terms.size());
        }
    }
}
