package com.posindex.query;

/**
 * NOT 子句在 AND 链中的执行时机。
 */
public enum NotPlacement {
    /** 先完成全部 AND/OR，最后做差集（默认） */
    LATE_NOT,
    /** 先从最短的肯定操作数中排除 NOT 子句，再参与求交 */
    EARLY_NOT
}
