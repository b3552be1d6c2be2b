package com.posindex.storage.dictionary;

import com.posindex.storage.DictionaryEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 词典二进制编解码器。
 *
 * @param <R> 解码结果的记录类型
 */
public interface DictionaryCodec<R> {

    /**
     * 将词条编码为二进制，输入无需有序。
     *
     * @param entries 词条
     * @return 编码字节
     * @throws IllegalArgumentException 词项或数值超出格式可表示范围时抛出
     */
    byte[] encode(List<DictionaryEntry> entries);

    /**
     * 解码二进制词典。
     *
     * @param data 编码字节
     * @return 按写入顺序的记录
     * @throws DictionaryCorruptionException 记录结构损坏时抛出，携带已解码部分
     */
    List<R> decode(byte[] data) throws DictionaryCorruptionException;

    /**
     * 每块词项数。
     */
    int blockSize();

    default void write(List<DictionaryEntry> entries, Path file) throws IOException {
        Files.write(file, encode(entries));
    }

    default List<R> read(Path file) throws IOException {
        return decode(Files.readAllBytes(file));
    }
}
