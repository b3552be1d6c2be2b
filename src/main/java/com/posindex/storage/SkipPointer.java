package com.posindex.storage;

/**
 * 跳表指针：从倒排列表下标 fromIndex 直接跳到 toIndex。
 *
 * @param fromIndex 起始下标
 * @param toIndex 目标下标，严格大于起始下标
 * @param jump 步长
 */
public record SkipPointer(int fromIndex, int toIndex, int jump) {
    public SkipPointer {
        if (fromIndex < 0) {
            throw new IllegalArgumentException("跳表起点不能为负数: " + fromIndex);
        }
        if (toIndex <= fromIndex) {
            throw new IllegalArgumentException("跳表目标必须大于起点: from=" + fromIndex + ", to=" + toIndex);
        }
        if (jump <= 0) {
            throw new IllegalArgumentException("跳表步长必须为正数: " + jump);
        }
    }
}
