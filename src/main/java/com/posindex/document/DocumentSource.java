package com.posindex.document;

import java.io.IOException;
import java.util.List;

/**
 * 分词文档来源，由外部的抽取/分词/词形还原流程提供。
 */
public interface DocumentSource {

    /**
     * 读取全部分词文档。
     */
    List<TokenizedDocument> documents() throws IOException;
}
