package com.posindex.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 未压缩词典：按词序保存 词项 → 倒排字节区间，构造后只读。
 *
 * 词条按词项严格递增，且区间首尾相接：后一词条的偏移等于前一词条偏移加长度。
 */
public final class Dictionary {
    private final TreeMap<String, DictionaryEntry> entriesByTerm = new TreeMap<>();

    /**
     * 由词条集合构造词典，并校验词序与区间连续性。
     *
     * @param entries 词条，可无序
     * @throws IllegalArgumentException 词项重复或区间不连续时抛出
     */
    public Dictionary(Collection<DictionaryEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("词条集合不能为null");
        }
        List<DictionaryEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(DictionaryEntry::term));
        DictionaryEntry previous = null;
        for (DictionaryEntry entry : sorted) {
            if (previous != null) {
                if (entry.term().equals(previous.term())) {
                    throw new IllegalArgumentException("词典词项重复: " + entry.term());
                }
                if (entry.offset() != previous.end()) {
                    throw new IllegalArgumentException("词典区间不连续: " + previous.term() + " 结束于 " + previous.end()
                        + ", " + entry.term() + " 开始于 " + entry.offset());
                }
            }
            entriesByTerm.put(entry.term(), entry);
            previous = entry;
        }
    }

    /**
     * 精确查找词项对应词条。
     *
     * @param term 词项
     * @return 命中的词条或空
     */
    public Optional<DictionaryEntry> lookup(String term) {
        return Optional.ofNullable(entriesByTerm.get(term));
    }

    public boolean contains(String term) {
        return entriesByTerm.containsKey(term);
    }

    public int size() {
        return entriesByTerm.size();
    }

    /**
     * 全部词条，按词序。
     */
    public List<DictionaryEntry> entries() {
        return List.copyOf(entriesByTerm.values());
    }

    /**
     * 全部词项，按词序。
     */
    public List<String> terms() {
        return List.copyOf(entriesByTerm.navigableKeySet());
    }

    /**
     * 全部倒排记录的总字节数。
     */
    public long totalLength() {
        long total = 0;
        for (DictionaryEntry entry : entriesByTerm.values()) {
            total += entry.length();
        }
        return total;
    }
}
