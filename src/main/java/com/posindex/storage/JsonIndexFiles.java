package com.posindex.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.posindex.document.DocumentTable;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 索引的 JSON 中间形式读写：倒排表、未压缩词典与文档长度表。
 *
 * 倒排表中的文档与跳表端点都使用外部文档标识。
 */
public final class JsonIndexFiles {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /** 单个倒排项 */
    record PostingJson(String doc, int[] positions) {
    }

    /** 跳表指针，端点为外部文档标识 */
    record SkipJson(String from, String to, int jump) {
    }

    record TermJson(List<PostingJson> postings, List<SkipJson> skips) {
    }

    /** 倒排记录字节区间 */
    record RangeJson(long offset, long length) {
    }

    private JsonIndexFiles() {
    }

    /**
     * 写出 词项 → {postings, skips}。
     */
    public static void writeInvertedIndex(Map<String, PostingList> postingsByTerm, DocumentTable documents, File file)
            throws IOException {
        Map<String, TermJson> json = new LinkedHashMap<>();
        for (Map.Entry<String, PostingList> entry : new TreeMap<>(postingsByTerm).entrySet()) {
            PostingList postingList = entry.getValue();
            List<PostingJson> postings = new ArrayList<>(postingList.size());
            for (int index = 0; index < postingList.size(); index++) {
                postings.add(new PostingJson(documents.externalId(postingList.docId(index)), postingList.positionsAt(index)));
            }
            List<SkipJson> skips = new ArrayList<>(postingList.skipCount());
            for (SkipPointer skip : postingList.skips()) {
                skips.add(new SkipJson(
                    documents.externalId(postingList.docId(skip.fromIndex())),
                    documents.externalId(postingList.docId(skip.toIndex())),
                    skip.jump()));
            }
            json.put(entry.getKey(), new TermJson(postings, skips));
        }
        write(json, file, "倒排表");
    }

    /**
     * 读取倒排表，外部文档标识经文档表换回内部编号，跳表端点换回下标。
     */
    public static Map<String, PostingList> readInvertedIndex(File file, DocumentTable documents) throws IOException {
        Map<String, TermJson> json = read(file, new TypeReference<TreeMap<String, TermJson>>() { }, "倒排表");
        Map<String, PostingList> postingsByTerm = new TreeMap<>();
        for (Map.Entry<String, TermJson> entry : json.entrySet()) {
            String term = entry.getKey();
            List<PostingJson> postings = entry.getValue().postings() == null ? List.of() : entry.getValue().postings();
            int[] docIds = new int[postings.size()];
            int[][] positions = new int[postings.size()][];
            for (int index = 0; index < postings.size(); index++) {
                docIds[index] = internalId(documents, postings.get(index).doc(), term);
                positions[index] = postings.get(index).positions() == null ? new int[0] : postings.get(index).positions();
            }
            List<SkipJson> skipsJson = entry.getValue().skips() == null ? List.of() : entry.getValue().skips();
            List<SkipPointer> skips = new ArrayList<>(skipsJson.size());
            for (SkipJson skip : skipsJson) {
                int from = indexOf(docIds, internalId(documents, skip.from(), term), term);
                int to = indexOf(docIds, internalId(documents, skip.to(), term), term);
                skips.add(new SkipPointer(from, to, skip.jump()));
            }
            try {
                postingsByTerm.put(term, new PostingList(docIds, positions, skips.toArray(new SkipPointer[0])));
            } catch (IllegalArgumentException exception) {
                throw new IOException("倒排表记录非法: term=" + term, exception);
            }
        }
        return postingsByTerm;
    }

    /**
     * 写出 词项 → {offset, length}。
     */
    public static void writeDictionary(Dictionary dictionary, File file) throws IOException {
        Map<String, RangeJson> json = new LinkedHashMap<>();
        for (DictionaryEntry entry : dictionary.entries()) {
            json.put(entry.term(), new RangeJson(entry.offset(), entry.length()));
        }
        write(json, file, "词典");
    }

    public static Dictionary readDictionary(File file) throws IOException {
        Map<String, RangeJson> json = read(file, new TypeReference<TreeMap<String, RangeJson>>() { }, "词典");
        List<DictionaryEntry> entries = new ArrayList<>(json.size());
        try {
            json.forEach((term, range) -> entries.add(new DictionaryEntry(term, range.offset(), range.length())));
            return new Dictionary(entries);
        } catch (IllegalArgumentException exception) {
            throw new IOException("词典文件内容非法: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 写出 外部文档标识 → 词项总数。
     */
    public static void writeDocuments(DocumentTable documents, File file) throws IOException {
        write(documents.lengthsByExternalId(), file, "文档表");
    }

    public static DocumentTable readDocuments(File file) throws IOException {
        Map<String, Integer> lengths = read(file, new TypeReference<TreeMap<String, Integer>>() { }, "文档表");
        try {
            return DocumentTable.fromLengths(lengths);
        } catch (IllegalArgumentException exception) {
            throw new IOException("文档表内容非法: " + file.getAbsolutePath(), exception);
        }
    }

    private static int internalId(DocumentTable documents, String externalId, String term) throws IOException {
        return documents.findByExternalId(externalId)
            .orElseThrow(() -> new IOException("倒排表引用未知文档: term=" + term + ", doc=" + externalId))
            .docId();
    }

    private static int indexOf(int[] docIds, int docId, String term) throws IOException {
        int index = Arrays.binarySearch(docIds, docId);
        if (index < 0) {
            throw new IOException("跳表端点不在倒排列表中: term=" + term + ", docId=" + docId);
        }
        return index;
    }

    private static void write(Object value, File file, String description) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException(description + "文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, value);
        } catch (IOException exception) {
            throw new IOException("写入" + description + "失败: " + file.getAbsolutePath(), exception);
        }
    }

    private static <T> T read(File file, TypeReference<T> type, String description) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException(description + "文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, type);
        } catch (IOException exception) {
            throw new IOException("读取" + description + "失败: " + file.getAbsolutePath(), exception);
        }
    }
}
