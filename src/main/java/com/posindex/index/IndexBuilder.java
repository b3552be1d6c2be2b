package com.posindex.index;

import com.posindex.config.Constants;
import com.posindex.config.EngineConfig;
import com.posindex.document.DocumentSource;
import com.posindex.document.DocumentTable;
import com.posindex.document.Token;
import com.posindex.document.TokenizedDocument;
import com.posindex.storage.PostingList;
import com.posindex.storage.SkipPointer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 位置倒排索引构建器。
 *
 * 累积 词项 → 文档 → 位置 映射，{@link #build()} 时一次性定型为不可变索引；构建器只能使用一次。
 * 格式错误的文档整体跳过并记录错误，不会中断整个语料的构建。
 */
public final class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final SkipStrategy skipStrategy;
    private final int indexThreads;
    private final Map<String, Map<String, List<Integer>>> positionsByTerm = new HashMap<>();
    private final Map<String, Integer> lengthsByDocId = new LinkedHashMap<>();
    private final List<DocumentError> errors = new ArrayList<>();
    private boolean built;

    public IndexBuilder() {
        this(EngineConfig.defaults());
    }

    public IndexBuilder(EngineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("配置不能为null");
        }
        if (config.getSkipStrategy() == null) {
            throw new IllegalArgumentException("跳表策略不能为null");
        }
        this.skipStrategy = config.getSkipStrategy();
        this.indexThreads = Math.max(1, Math.min(config.getIndexThreads(), Constants.MAX_INDEX_THREADS));
    }

    /**
     * 对文档来源执行完整构建。
     *
     * @param source 文档来源
     * @param config 引擎配置
     * @return 构建结果
     * @throws IOException 读取文档来源失败时抛出
     */
    public static BuildResult build(DocumentSource source, EngineConfig config) throws IOException {
        IndexBuilder builder = new IndexBuilder(config);
        builder.addAll(source);
        return builder.build();
    }

    /**
     * 逐个加入文档来源中的全部文档。
     */
    public IndexBuilder addAll(DocumentSource source) throws IOException {
        if (source == null) {
            throw new IllegalArgumentException("文档来源不能为null");
        }
        for (TokenizedDocument document : source.documents()) {
            addDocument(document);
        }
        return this;
    }

    /**
     * 加入一个文档。格式错误时跳过该文档并记录错误。
     *
     * @param document 分词文档
     * @return 文档被接受返回 true
     */
    public boolean addDocument(TokenizedDocument document) {
        ensureNotBuilt();
        if (document == null) {
            throw new IllegalArgumentException("文档不能为null");
        }
        String docId = document.docId();
        String problem = validate(document);
        if (problem != null) {
            errors.add(new DocumentError(docId, problem));
            logger.warn("跳过格式错误的文档: docId={}, reason={}", docId, problem);
            return false;
        }

        lengthsByDocId.put(docId, document.length());
        for (Token token : document.tokens()) {
            positionsByTerm
                .computeIfAbsent(token.term(), key -> new LinkedHashMap<>())
                .computeIfAbsent(docId, key -> new ArrayList<>())
                .add(token.position());
        }
        return true;
    }

    private String validate(TokenizedDocument document) {
        if (lengthsByDocId.containsKey(document.docId())) {
            return "文档标识重复";
        }
        int previousPosition = -1;
        for (int index = 0; index < document.tokens().size(); index++) {
            Token token = document.tokens().get(index);
            if (token == null || token.term() == null || token.term().isBlank()) {
                return "第 " + index + " 个词项为空";
            }
            if (token.position() < 0) {
                return "位置为负数: index=" + index + ", position=" + token.position();
            }
            if (token.position() <= previousPosition) {
                return "位置未严格递增: index=" + index + ", previous=" + previousPosition + ", position=" + token.position();
            }
            previousPosition = token.position();
        }
        return null;
    }

    /**
     * 定型为不可变索引。
     *
     * @return 构建结果，包含全部文档级错误
     * @throws IllegalStateException 重复调用时抛出
     */
    public BuildResult build() {
        ensureNotBuilt();
        built = true;

        DocumentTable documentTable = DocumentTable.fromLengths(lengthsByDocId);
        Map<String, Integer> internalIds = new HashMap<>(documentTable.size() * 2);
        documentTable.documents().forEach(info -> internalIds.put(info.externalId(), info.docId()));

        List<String> terms = new ArrayList<>(new TreeMap<>(positionsByTerm).keySet());
        logger.debug("开始定型倒排列表: terms={}, threads={}, skipStrategy={}", terms.size(), indexThreads, skipStrategy);
        Map<String, PostingList> postings = indexThreads > 1 && terms.size() > 1
            ? materializeParallel(terms, internalIds)
            : materialize(terms, internalIds);

        positionsByTerm.clear();
        InvertedIndex index = new InvertedIndex(postings, documentTable, skipStrategy);
        logger.info("索引构建完成: documents={}, terms={}, errors={}", documentTable.size(), index.termCount(), errors.size());
        return new BuildResult(index, errors);
    }

    private Map<String, PostingList> materialize(List<String> terms, Map<String, Integer> internalIds) {
        Map<String, PostingList> postings = new TreeMap<>();
        for (String term : terms) {
            postings.put(term, toPostingList(positionsByTerm.get(term), internalIds));
        }
        return postings;
    }

    /**
     * 按词项分区并行定型，各分区之间没有共享的可变状态。
     */
    private Map<String, PostingList> materializeParallel(List<String> terms, Map<String, Integer> internalIds) {
        int partitions = Math.min(indexThreads, terms.size());
        int partitionSize = (terms.size() + partitions - 1) / partitions;
        ExecutorService executor = Executors.newFixedThreadPool(partitions);
        try {
            List<Future<Map<String, PostingList>>> futures = new ArrayList<>(partitions);
            for (int start = 0; start < terms.size(); start += partitionSize) {
                List<String> partition = terms.subList(start, Math.min(start + partitionSize, terms.size()));
                futures.add(executor.submit(() -> materialize(partition, internalIds)));
            }
            Map<String, PostingList> postings = new TreeMap<>();
            for (Future<Map<String, PostingList>> future : futures) {
                postings.putAll(future.get());
            }
            return postings;
        } catch (ExecutionException exception) {
            throw new IllegalStateException("并行定型倒排列表失败", exception.getCause());
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("并行定型倒排列表被中断", exception);
        } finally {
            executor.shutdownNow();
        }
    }

    private PostingList toPostingList(Map<String, List<Integer>> positionsByDocId, Map<String, Integer> internalIds) {
        TreeMap<Integer, int[]> sorted = new TreeMap<>();
        for (Map.Entry<String, List<Integer>> entry : positionsByDocId.entrySet()) {
            int[] positions = entry.getValue().stream().mapToInt(Integer::intValue).toArray();
            sorted.put(internalIds.get(entry.getKey()), positions);
        }
        int[] docIds = new int[sorted.size()];
        int[][] positions = new int[sorted.size()][];
        int index = 0;
        for (Map.Entry<Integer, int[]> entry : sorted.entrySet()) {
            docIds[index] = entry.getKey();
            positions[index] = entry.getValue();
            index++;
        }
        return new PostingList(docIds, positions, buildSkips(docIds.length, skipStrategy));
    }

    /**
     * 为长度为 n 的倒排列表生成跳表指针。
     *
     * 步长小于 2 时不生成；否则从每个步长起点指向下一个起点，目标必须落在列表内。
     *
     * @param listLength 倒排列表长度
     * @param strategy 步长策略
     * @return 跳表指针
     */
    public static SkipPointer[] buildSkips(int listLength, SkipStrategy strategy) {
        int step = strategy.stepFor(listLength);
        if (step < Constants.MIN_SKIP_STEP) {
            return new SkipPointer[0];
        }
        List<SkipPointer> skips = new ArrayList<>();
        for (int index = 0; index < listLength; index += step) {
            int target = index + step;
            if (target < listLength) {
                skips.add(new SkipPointer(index, target, step));
            }
        }
        return skips.toArray(new SkipPointer[0]);
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("IndexBuilder 只能使用一次");
        }
    }
}
