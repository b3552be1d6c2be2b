package com.posindex.config;

import com.posindex.index.SkipStrategy;
import com.posindex.query.DistributionStrategy;
import com.posindex.query.EvaluationStrategy;
import com.posindex.query.NotPlacement;
import com.posindex.query.TermOrdering;
import com.posindex.storage.dictionary.DictionaryFormat;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或调用方注入，覆盖Constants默认值
 */
public class EngineConfig {
    private Path indexDir = Paths.get("./index");
    private int indexThreads = Constants.DEFAULT_INDEX_THREADS;
    private int blockSize = Constants.DEFAULT_BLOCK_SIZE;
    private SkipStrategy skipStrategy = SkipStrategy.SQRT;
    private DictionaryFormat dictionaryFormat = DictionaryFormat.FRONT_CODING;
    private TermOrdering termOrdering = TermOrdering.ASCENDING_DOC_FREQ;
    private DistributionStrategy distributionStrategy = DistributionStrategy.OR_THEN_AND;
    private NotPlacement notPlacement = NotPlacement.LATE_NOT;
    private boolean useSkips = true;
    private int topN = Constants.DEFAULT_TOP_N;

    public Path getIndexDir() {
        return indexDir;
    }

    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }

    public int getIndexThreads() {
        return indexThreads;
    }

    public void setIndexThreads(int indexThreads) {
        this.indexThreads = indexThreads;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public void setBlockSize(int blockSize) {
        this.blockSize = blockSize;
    }

    public SkipStrategy getSkipStrategy() {
        return skipStrategy;
    }

    public void setSkipStrategy(SkipStrategy skipStrategy) {
        this.skipStrategy = skipStrategy;
    }

    public DictionaryFormat getDictionaryFormat() {
        return dictionaryFormat;
    }

    public void setDictionaryFormat(DictionaryFormat dictionaryFormat) {
        this.dictionaryFormat = dictionaryFormat;
    }

    public TermOrdering getTermOrdering() {
        return termOrdering;
    }

    public void setTermOrdering(TermOrdering termOrdering) {
        this.termOrdering = termOrdering;
    }

    public DistributionStrategy getDistributionStrategy() {
        return distributionStrategy;
    }

    public void setDistributionStrategy(DistributionStrategy distributionStrategy) {
        this.distributionStrategy = distributionStrategy;
    }

    public NotPlacement getNotPlacement() {
        return notPlacement;
    }

    public void setNotPlacement(NotPlacement notPlacement) {
        this.notPlacement = notPlacement;
    }

    public boolean isUseSkips() {
        return useSkips;
    }

    public void setUseSkips(boolean useSkips) {
        this.useSkips = useSkips;
    }

    public int getTopN() {
        return topN;
    }

    public void setTopN(int topN) {
        this.topN = topN;
    }

    /**
     * 汇总布尔查询相关配置为求值策略。
     */
    public EvaluationStrategy toEvaluationStrategy() {
        return new EvaluationStrategy(termOrdering, distributionStrategy, notPlacement, useSkips);
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
