package com.posindex.index;

import java.util.List;

/**
 * 一次构建的结果：索引本身与被跳过文档的错误列表。
 *
 * @param index 构建出的倒排索引
 * @param errors 构建过程中收集的文档级错误，按出现顺序
 */
public record BuildResult(InvertedIndex index, List<DocumentError> errors) {
    public BuildResult {
        if (index == null) {
            throw new IllegalArgumentException("index 不能为null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
