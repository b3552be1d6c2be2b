package com.posindex.query;

/**
 * 多词项 AND 的处理顺序。
 */
public enum TermOrdering {
    /** 按文档频率从低到高处理，最短列表最先约束结果规模（默认） */
    ASCENDING_DOC_FREQ,
    /** 按文档频率从高到低处理，仅作为对照基线 */
    DESCENDING_DOC_FREQ
}
