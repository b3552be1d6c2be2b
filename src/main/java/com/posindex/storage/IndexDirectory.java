package com.posindex.storage;

import com.posindex.config.Constants;
import com.posindex.config.EngineConfig;
import com.posindex.document.DocumentTable;
import com.posindex.index.InvertedIndex;
import com.posindex.index.SkipStrategy;
import com.posindex.storage.dictionary.BlockingCodec;
import com.posindex.storage.dictionary.DictionaryFormat;
import com.posindex.storage.dictionary.FrontCodingCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 索引目录：倒排文件、词典（JSON 与两种压缩格式）、文档表与元数据的整体保存和加载。
 */
public final class IndexDirectory {
    private static final Logger logger = LoggerFactory.getLogger(IndexDirectory.class);

    private IndexDirectory() {
    }

    /**
     * 将索引写入目录，覆盖同名文件。
     *
     * @param index 倒排索引
     * @param directory 目标目录，不存在时创建
     * @param config 引擎配置，决定词典块大小与首选的压缩格式
     * @return 写入的元数据
     * @throws IOException 写入失败时抛出
     */
    public static IndexMeta save(InvertedIndex index, Path directory, EngineConfig config) throws IOException {
        if (index == null || directory == null || config == null) {
            throw new IllegalArgumentException("索引、目录与配置不能为null");
        }
        List<DictionaryFormat> binaryFormats = encodableFormats(index.postingsByTerm().keySet());
        Files.createDirectories(directory);

        List<DictionaryEntry> entries = new ArrayList<>(index.termCount());
        Path postingsPath = directory.resolve(Constants.POSTINGS_FILE);
        try (PostingsWriter writer = new PostingsWriter(postingsPath.toFile())) {
            for (Map.Entry<String, PostingList> entry : index.postingsByTerm().entrySet()) {
                entries.add(writer.writePostingList(entry.getKey(), entry.getValue()));
            }
        }
        Dictionary dictionary = new Dictionary(entries);

        JsonIndexFiles.writeDictionary(dictionary, directory.resolve(Constants.DICTIONARY_JSON_FILE).toFile());
        for (DictionaryFormat format : DictionaryFormat.values()) {
            Path file = directory.resolve(format.fileName());
            if (binaryFormats.contains(format)) {
                format.codec(config.getBlockSize()).write(entries, file);
            } else {
                Files.deleteIfExists(file);
            }
        }
        JsonIndexFiles.writeInvertedIndex(index.postingsByTerm(), index.documents(),
            directory.resolve(Constants.INVERTED_INDEX_JSON_FILE).toFile());
        JsonIndexFiles.writeDocuments(index.documents(), directory.resolve(Constants.DOCUMENTS_FILE).toFile());

        IndexMeta meta = new IndexMeta(
            index.documentCount(),
            index.termCount(),
            Files.size(postingsPath),
            config.getDictionaryFormat(),
            binaryFormats,
            config.getBlockSize(),
            index.skipStrategy(),
            Instant.now());
        meta.writeTo(directory.resolve(Constants.META_FILE).toFile());
        logger.info("索引已保存: dir={}, documents={}, terms={}, postingsBytes={}",
            directory, meta.docCount(), meta.termCount(), meta.postingsBytes());
        return meta;
    }

    /**
     * 在写入任何文件之前筛出能容纳全部词项的压缩格式，超限的格式跳过并告警。
     */
    private static List<DictionaryFormat> encodableFormats(Collection<String> terms) {
        List<DictionaryFormat> formats = new ArrayList<>();
        for (DictionaryFormat format : DictionaryFormat.values()) {
            Optional<String> oversized = format.firstOversizedTerm(terms);
            if (oversized.isPresent()) {
                logger.warn("词项超过 {} 格式的 {} 字节上限，不写入 {}: term={}...",
                    format, format.maxTermBytes(), format.fileName(), abbreviate(oversized.get()));
            } else {
                formats.add(format);
            }
        }
        return formats;
    }

    private static String abbreviate(String term) {
        return term.length() <= 32 ? term : term.substring(0, 32);
    }

    /**
     * 从目录加载索引。优先使用 JSON 词典，缺失时按元数据选择压缩词典。
     *
     * @param directory 索引目录
     * @return 倒排索引
     * @throws IOException 文件缺失或损坏时抛出
     */
    public static InvertedIndex load(Path directory) throws IOException {
        if (directory == null) {
            throw new IllegalArgumentException("索引目录不能为null");
        }
        if (!Files.isDirectory(directory)) {
            throw new IOException("索引目录不存在: " + directory.toAbsolutePath());
        }
        Path metaPath = directory.resolve(Constants.META_FILE);
        SkipStrategy skipStrategy = Files.exists(metaPath)
            ? IndexMeta.readFrom(metaPath.toFile()).skipStrategy()
            : SkipStrategy.SQRT;

        DocumentTable documents = JsonIndexFiles.readDocuments(directory.resolve(Constants.DOCUMENTS_FILE).toFile());
        Dictionary dictionary = loadDictionary(directory);

        Map<String, PostingList> postingsByTerm = new TreeMap<>();
        try (PostingsReader reader = new PostingsReader(directory.resolve(Constants.POSTINGS_FILE).toFile())) {
            for (DictionaryEntry entry : dictionary.entries()) {
                postingsByTerm.put(entry.term(), reader.read(entry));
            }
        }
        InvertedIndex index;
        try {
            index = new InvertedIndex(postingsByTerm, documents, skipStrategy);
        } catch (IllegalArgumentException exception) {
            throw new IOException("索引文件之间不一致: " + directory.toAbsolutePath(), exception);
        }
        logger.info("索引已加载: dir={}, documents={}, terms={}", directory, index.documentCount(), index.termCount());
        return index;
    }

    /**
     * 加载目录中的词典：优先 JSON 词典，其次元数据记录的首选压缩格式，再次其余已写入的压缩格式。
     *
     * @throws IOException 没有可用词典或词典内容非法时抛出
     */
    public static Dictionary loadDictionary(Path directory) throws IOException {
        Path jsonPath = directory.resolve(Constants.DICTIONARY_JSON_FILE);
        if (Files.exists(jsonPath)) {
            return JsonIndexFiles.readDictionary(jsonPath.toFile());
        }
        for (DictionaryFormat format : fallbackFormats(directory)) {
            Path file = directory.resolve(format.fileName());
            if (Files.exists(file)) {
                logger.debug("未找到 {}，改用 {}", Constants.DICTIONARY_JSON_FILE, format.fileName());
                return readBinaryDictionary(directory, format, file);
            }
        }
        throw new IOException("索引目录缺少词典文件: " + directory.toAbsolutePath());
    }

    private static List<DictionaryFormat> fallbackFormats(Path directory) throws IOException {
        Path metaPath = directory.resolve(Constants.META_FILE);
        if (!Files.exists(metaPath)) {
            return List.of(DictionaryFormat.values());
        }
        IndexMeta meta = IndexMeta.readFrom(metaPath.toFile());
        List<DictionaryFormat> formats = new ArrayList<>();
        if (meta.dictionaryFormat() != null && meta.binaryDictionaries().contains(meta.dictionaryFormat())) {
            formats.add(meta.dictionaryFormat());
        }
        for (DictionaryFormat format : meta.binaryDictionaries()) {
            if (!formats.contains(format)) {
                formats.add(format);
            }
        }
        return formats;
    }

    private static Dictionary readBinaryDictionary(Path directory, DictionaryFormat format, Path file)
            throws IOException {
        try {
            List<DictionaryEntry> entries;
            if (format == DictionaryFormat.BLOCKING) {
                long recordsEnd;
                try (PostingsReader reader = new PostingsReader(directory.resolve(Constants.POSTINGS_FILE).toFile())) {
                    recordsEnd = reader.getDataLength();
                }
                entries = BlockingCodec.toEntries(new BlockingCodec().read(file), recordsEnd);
            } else {
                entries = new FrontCodingCodec().read(file);
            }
            return new Dictionary(entries);
        } catch (IllegalArgumentException exception) {
            throw new IOException("压缩词典内容非法: " + file, exception);
        }
    }
}
