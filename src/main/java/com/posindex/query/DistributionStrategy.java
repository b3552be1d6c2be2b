package com.posindex.query;

/**
 * AND 与 OR 混合时的求值方式，两种方式结果一致，代价取决于分支选择性。
 */
public enum DistributionStrategy {
    /** 先对 OR 分支求并集，再整体参与 AND（默认） */
    OR_THEN_AND,
    /** 将 AND 分配到每个 OR 分支，分别求交后再合并 */
    AND_DISTRIBUTED_INTO_OR
}
