package com.posindex.storage.dictionary;

import java.io.IOException;
import java.util.List;

/**
 * 压缩词典结构损坏：解码在第一条无法恢复的记录处停止。
 *
 * 携带损坏位置之前已成功解码的记录，调用方可自行决定是否使用部分结果。
 */
public class DictionaryCorruptionException extends IOException {
    private final transient List<?> partialResult;
    private final long position;

    public DictionaryCorruptionException(String message, long position, List<?> partialResult) {
        super(message + ", position=" + position + ", decoded=" + partialResult.size());
        this.position = position;
        this.partialResult = List.copyOf(partialResult);
    }

    /**
     * 损坏记录的起始字节位置。
     */
    public long getPosition() {
        return position;
    }

    /**
     * 损坏位置之前已解码的记录。
     */
    public List<?> partialResult() {
        return partialResult;
    }
}
