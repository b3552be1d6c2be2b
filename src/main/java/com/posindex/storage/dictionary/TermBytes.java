package com.posindex.storage.dictionary;

import com.posindex.storage.DictionaryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 词项 UTF-8 字节的排序与容错解码。
 */
final class TermBytes {
    private static final Logger logger = LoggerFactory.getLogger(TermBytes.class);

    /**
     * 词条及其 UTF-8 字节。
     */
    record EncodedEntry(DictionaryEntry entry, byte[] bytes) {
    }

    private TermBytes() {
    }

    /**
     * 按无符号 UTF-8 字节序排序词条，拒绝空词项与重复词项。
     */
    static List<EncodedEntry> sortByBytes(List<DictionaryEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("词条列表不能为null");
        }
        List<EncodedEntry> encoded = new ArrayList<>(entries.size());
        for (DictionaryEntry entry : entries) {
            if (entry == null || entry.term().isEmpty()) {
                throw new IllegalArgumentException("词典词项不能为空");
            }
            encoded.add(new EncodedEntry(entry, entry.term().getBytes(StandardCharsets.UTF_8)));
        }
        encoded.sort((left, right) -> Arrays.compareUnsigned(left.bytes(), right.bytes()));
        for (int index = 1; index < encoded.size(); index++) {
            if (Arrays.equals(encoded.get(index).bytes(), encoded.get(index - 1).bytes())) {
                throw new IllegalArgumentException("词典词项重复: " + encoded.get(index).entry().term());
            }
        }
        return encoded;
    }

    /**
     * 字节级最长公共前缀长度。
     */
    static int commonPrefixLength(byte[] left, byte[] right) {
        int mismatch = Arrays.mismatch(left, right);
        return mismatch < 0 ? left.length : mismatch;
    }

    /**
     * 解码词项字节，非法序列替换为 U+FFFD 并记录告警。
     *
     * @param bytes 词项字节
     * @param position 该词项在编码数据中的字节位置，仅用于日志
     * @return 解码结果
     */
    static String decode(byte[] bytes, long position) {
        CharsetDecoder strict = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return strict.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException exception) {
            logger.warn("词项字节不是合法 UTF-8，已替换: position={}, bytes={}", position, bytes.length);
        }
        CharsetDecoder lenient = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            CharBuffer decoded = lenient.decode(ByteBuffer.wrap(bytes));
            return decoded.toString();
        } catch (CharacterCodingException exception) {
            throw new IllegalStateException("替换模式下解码失败: position=" + position, exception);
        }
    }
}
