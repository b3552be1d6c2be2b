package com.posindex.query;

import com.posindex.config.EngineConfig;
import com.posindex.index.InvertedIndex;
import com.posindex.scoring.RankedHit;
import com.posindex.scoring.VectorSpaceRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 查询入口：布尔查询、短语查询与向量空间排序。
 *
 * 每次查询独立分配结果，实例可被多个线程共享。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final BooleanEvaluator booleanEvaluator;
    private final PhraseVerifier phraseVerifier;
    private final VectorSpaceRanker ranker;
    private final int defaultTopN;

    public QueryEngine(InvertedIndex index) {
        this(index, EngineConfig.defaults());
    }

    /**
     * 使用 EngineConfig 注入求值策略与默认返回条数。
     */
    public QueryEngine(InvertedIndex index, EngineConfig config) {
        if (index == null || config == null) {
            throw new IllegalArgumentException("索引与配置不能为null");
        }
        this.booleanEvaluator = new BooleanEvaluator(index, config.toEvaluationStrategy());
        this.phraseVerifier = new PhraseVerifier(index);
        this.ranker = new VectorSpaceRanker(index);
        this.defaultTopN = config.getTopN();
    }

    /**
     * 解析并求值布尔查询字符串。
     *
     * @throws QueryParseException 查询语法错误时抛出
     */
    public BooleanResult searchBoolean(String query) {
        long startNanos = System.nanoTime();
        BooleanResult result = searchBoolean(new QueryParser().parse(query));
        logger.debug("布尔查询 [{}] 命中 {} 个文档, 耗时 {} us", query, result.size(), (System.nanoTime() - startNanos) / 1000);
        return result;
    }

    public BooleanResult searchBoolean(QueryNode query) {
        return booleanEvaluator.evaluate(query);
    }

    public PhraseResult searchPhrase(List<String> terms) {
        return phraseVerifier.verify(terms);
    }

    /**
     * 按空白切分已规范化文本并排序。
     */
    public List<RankedHit> rank(String freeText, int topN) {
        if (freeText == null || freeText.isBlank()) {
            return List.of();
        }
        return ranker.rank(List.of(freeText.trim().split("\\s+")), topN);
    }

    public List<RankedHit> rank(String freeText) {
        return rank(freeText, defaultTopN);
    }

    public VectorSpaceRanker ranker() {
        return ranker;
    }
}
