package com.posindex.storage.dictionary;

import com.posindex.config.Constants;
import com.posindex.storage.DictionaryEntry;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 前端编码词典。
 *
 * 每块首个词项为基准词，完整存储；块内后续词项只存储与基准词的公共前缀长度和后缀字节。
 * 记录格式：[prefix_len:u8][suffix_len:u8][suffix][offset:u32 LE][length:u32 LE]。
 * 解码时遇到前缀长度为 0 的记录即将其作为新的基准词。
 */
public final class FrontCodingCodec implements DictionaryCodec<DictionaryEntry> {
    private static final int FIXED_FIELD_BYTES = 2 * Integer.BYTES;

    private final int blockSize;

    public FrontCodingCodec() {
        this(Constants.DEFAULT_BLOCK_SIZE);
    }

    public FrontCodingCodec(int blockSize) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize 必须为正数: " + blockSize);
        }
        this.blockSize = blockSize;
    }

    @Override
    public int blockSize() {
        return blockSize;
    }

    @Override
    public byte[] encode(List<DictionaryEntry> entries) {
        List<TermBytes.EncodedEntry> sorted = TermBytes.sortByBytes(entries);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] base = null;
        for (int index = 0; index < sorted.size(); index++) {
            TermBytes.EncodedEntry encoded = sorted.get(index);
            byte[] termBytes = encoded.bytes();
            if (termBytes.length > Constants.FRONT_CODING_MAX_TERM_BYTES) {
                throw new IllegalArgumentException("前端编码词项超过 " + Constants.FRONT_CODING_MAX_TERM_BYTES
                    + " 字节: term=" + encoded.entry().term() + ", bytes=" + termBytes.length);
            }
            int prefixLength = 0;
            if (index % blockSize != 0 && base != null) {
                prefixLength = TermBytes.commonPrefixLength(base, termBytes);
            }
            // 前缀为 0 的记录在解码端即成为基准词，编码端保持一致
            if (prefixLength == 0) {
                base = termBytes;
            }
            int suffixLength = termBytes.length - prefixLength;
            LittleEndian.writeU8(out, prefixLength);
            LittleEndian.writeU8(out, suffixLength);
            out.write(termBytes, prefixLength, suffixLength);
            LittleEndian.writeU32(out, encoded.entry().offset());
            LittleEndian.writeU32(out, encoded.entry().length());
        }
        return out.toByteArray();
    }

    @Override
    public List<DictionaryEntry> decode(byte[] data) throws DictionaryCorruptionException {
        if (data == null) {
            throw new IllegalArgumentException("词典数据不能为null");
        }
        ByteBuffer buffer = LittleEndian.wrap(data);
        List<DictionaryEntry> decoded = new ArrayList<>();
        byte[] base = null;
        while (buffer.hasRemaining()) {
            int recordStart = buffer.position();
            if (buffer.remaining() < 2) {
                throw new DictionaryCorruptionException("前端编码记录头被截断", recordStart, decoded);
            }
            int prefixLength = LittleEndian.readU8(buffer);
            int suffixLength = LittleEndian.readU8(buffer);
            if (buffer.remaining() < suffixLength + FIXED_FIELD_BYTES) {
                throw new DictionaryCorruptionException("前端编码记录被截断: suffix=" + suffixLength, recordStart, decoded);
            }
            byte[] termBytes;
            if (prefixLength == 0) {
                termBytes = new byte[suffixLength];
                buffer.get(termBytes);
                base = termBytes;
            } else {
                if (base == null || prefixLength > base.length) {
                    throw new DictionaryCorruptionException("前缀长度超过基准词: prefix=" + prefixLength
                        + ", base=" + (base == null ? 0 : base.length), recordStart, decoded);
                }
                termBytes = Arrays.copyOf(base, prefixLength + suffixLength);
                buffer.get(termBytes, prefixLength, suffixLength);
            }
            long offset = LittleEndian.readU32(buffer);
            long length = LittleEndian.readU32(buffer);
            decoded.add(new DictionaryEntry(TermBytes.decode(termBytes, recordStart), offset, length));
        }
        return decoded;
    }
}
