package com.posindex.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.posindex.index.SkipStrategy;
import com.posindex.storage.dictionary.DictionaryFormat;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * 索引目录元数据。
 *
 * @param dictionaryFormat 缺少 JSON 词典时优先使用的压缩词典格式
 * @param binaryDictionaries 实际写入的压缩词典格式，词项超出格式上限时该格式不写入
 */
public record IndexMeta(
    int docCount,
    int termCount,
    long postingsBytes,
    DictionaryFormat dictionaryFormat,
    List<DictionaryFormat> binaryDictionaries,
    int blockSize,
    SkipStrategy skipStrategy,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public IndexMeta {
        binaryDictionaries = binaryDictionaries == null ? List.of() : List.copyOf(binaryDictionaries);
    }

    /**
     * 将元数据写入指定 JSON 文件。
     *
     * @param file 元数据文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取元数据。
     */
    public static IndexMeta readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, IndexMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }
}
