package com.posindex.config;

/**
 * 全局常量定义
 *
 * 包含存储格式魔数、词典压缩参数、跳表参数、排序参数与索引目录文件名
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式魔数 ====================
    /** 倒排列表文件魔数 "PXPI" */
    public static final int POSTINGS_MAGIC = 0x50585049;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    /** 倒排文件头长度：魔数 + 版本号 */
    public static final int POSTINGS_HEADER_BYTES = Integer.BYTES + Short.BYTES;

    // ==================== 词典压缩参数 ====================
    /** 每个压缩块包含的词项数 */
    public static final int DEFAULT_BLOCK_SIZE = 4;
    /** 前端编码下词项 UTF-8 字节长度上限（前缀/后缀长度均为单字节） */
    public static final int FRONT_CODING_MAX_TERM_BYTES = 255;
    /** 按块存储每条记录固定的词项槽位数 */
    public static final int BLOCKING_TERM_SLOTS = 4;
    /** 按块存储每条记录的辅助长度字段数 */
    public static final int BLOCKING_AUX_FIELDS = 3;
    /** 按块存储单个词项长度上限（u16） */
    public static final int BLOCKING_MAX_TERM_BYTES = 0xFFFF;
    /** u32 字段可表示的最大值 */
    public static final long MAX_U32 = 0xFFFF_FFFFL;

    // ==================== 跳表参数 ====================
    /** 跳表指针生效的最小步长，步长为1的倒排列表不生成指针 */
    public static final int MIN_SKIP_STEP = 2;

    // ==================== 排序参数 ====================
    /** 向量空间检索默认返回条数 */
    public static final int DEFAULT_TOP_N = 10;
    /** 单次排序返回条数上限 */
    public static final int MAX_TOP_N = 10_000;

    // ==================== 线程参数 ====================
    /** 默认索引工作线程数 */
    public static final int DEFAULT_INDEX_THREADS = 1;
    /** 索引线程安全上限 */
    public static final int MAX_INDEX_THREADS = Math.max(1, Runtime.getRuntime().availableProcessors() * 2);

    // ==================== 索引目录文件名 ====================
    public static final String POSTINGS_FILE = "postings.bin";
    public static final String DICTIONARY_JSON_FILE = "dictionary.json";
    public static final String FRONT_CODED_DICTIONARY_FILE = "dictionary_frontcoded.bin";
    public static final String BLOCKED_DICTIONARY_FILE = "dictionary_blocking.bin";
    public static final String INVERTED_INDEX_JSON_FILE = "inverted_index.json";
    public static final String DOCUMENTS_FILE = "documents.json";
    public static final String META_FILE = "index_meta.json";
}
