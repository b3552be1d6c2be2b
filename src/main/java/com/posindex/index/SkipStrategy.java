package com.posindex.index;

/**
 * 跳表步长策略。
 *
 * SQRT 为默认策略，其余策略用于比较不同步长下的空间与跳跃收益。
 */
public enum SkipStrategy {
    /** 步长 = max(1, floor(sqrt(n))) */
    SQRT,
    /** 步长 = max(1, n / 10) */
    DIV10,
    /** 固定步长 50 */
    FIXED_50,
    /** 固定步长 200 */
    FIXED_200;

    /**
     * 根据倒排列表长度计算步长。
     *
     * @param listLength 倒排列表长度
     * @return 步长，至少为1
     */
    public int stepFor(int listLength) {
        if (listLength < 0) {
            throw new IllegalArgumentException("倒排列表长度不能为负数: " + listLength);
        }
        return switch (this) {
            case SQRT -> Math.max(1, (int) Math.floor(Math.sqrt(listLength)));
            case DIV10 -> Math.max(1, listLength / 10);
            case FIXED_50 -> 50;
            case FIXED_200 -> 200;
        };
    }
}
