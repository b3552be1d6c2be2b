package com.posindex.query;

/**
 * 布尔查询求值策略组合。
 *
 * @param termOrdering AND 链的词项处理顺序
 * @param distribution AND/OR 混合时的求值方式
 * @param notPlacement NOT 子句的执行时机
 * @param useSkips 两侧均为原始倒排列表时是否使用跳表指针求交
 */
public record EvaluationStrategy(
        TermOrdering termOrdering,
        DistributionStrategy distribution,
        NotPlacement notPlacement,
        boolean useSkips
) {
    public EvaluationStrategy {
        if (termOrdering == null || distribution == null || notPlacement == null) {
            throw new IllegalArgumentException("求值策略字段不能为null");
        }
    }

    /**
     * 默认策略：低频优先、先OR后AND、后NOT、启用跳表。
     */
    public static EvaluationStrategy defaults() {
        return new EvaluationStrategy(
                TermOrdering.ASCENDING_DOC_FREQ,
                DistributionStrategy.OR_THEN_AND,
                NotPlacement.LATE_NOT,
                true);
    }

    public EvaluationStrategy withTermOrdering(TermOrdering ordering) {
        return new EvaluationStrategy(ordering, distribution, notPlacement, useSkips);
    }

    public EvaluationStrategy withDistribution(DistributionStrategy strategy) {
        return new EvaluationStrategy(termOrdering, strategy, notPlacement, useSkips);
    }

    public EvaluationStrategy withNotPlacement(NotPlacement placement) {
        return new EvaluationStrategy(termOrdering, distribution, placement, useSkips);
    }

    public EvaluationStrategy withSkips(boolean enabled) {
        return new EvaluationStrategy(termOrdering, distribution, notPlacement, enabled);
    }
}
