package com.posindex.storage.dictionary;

import com.posindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Optional;

/**
 * 词典二进制压缩格式。
 */
public enum DictionaryFormat {
    FRONT_CODING(Constants.FRONT_CODED_DICTIONARY_FILE, Constants.FRONT_CODING_MAX_TERM_BYTES),
    BLOCKING(Constants.BLOCKED_DICTIONARY_FILE, Constants.BLOCKING_MAX_TERM_BYTES);

    private static final Logger logger = LoggerFactory.getLogger(DictionaryFormat.class);

    private final String fileName;
    private final int maxTermBytes;

    DictionaryFormat(String fileName, int maxTermBytes) {
        this.fileName = fileName;
        this.maxTermBytes = maxTermBytes;
    }

    /**
     * 该格式在索引目录中的文件名。
     */
    public String fileName() {
        return fileName;
    }

    /**
     * 单个词项 UTF-8 编码后的最大字节数。
     */
    public int maxTermBytes() {
        return maxTermBytes;
    }

    /**
     * 找出第一个超出本格式长度上限的词项。
     *
     * @param terms 待编码词项
     * @return 超限词项，全部可编码时为空
     */
    public Optional<String> firstOversizedTerm(Collection<String> terms) {
        for (String term : terms) {
            if (term.getBytes(StandardCharsets.UTF_8).length > maxTermBytes) {
                return Optional.of(term);
            }
        }
        return Optional.empty();
    }

    /**
     * 按块大小创建对应编解码器，按块存储的块大小不超过其槽位数。
     *
     * @param blockSize 每块词项数
     * @return 编解码器
     */
    public DictionaryCodec<?> codec(int blockSize) {
        return switch (this) {
            case FRONT_CODING -> new FrontCodingCodec(blockSize);
            case BLOCKING -> {
                if (blockSize > Constants.BLOCKING_TERM_SLOTS) {
                    logger.warn("按块存储每块最多 {} 个词项，blockSize={} 已按 {} 处理",
                        Constants.BLOCKING_TERM_SLOTS, blockSize, Constants.BLOCKING_TERM_SLOTS);
                    yield new BlockingCodec(Constants.BLOCKING_TERM_SLOTS);
                }
                yield new BlockingCodec(blockSize);
            }
        };
    }
}
