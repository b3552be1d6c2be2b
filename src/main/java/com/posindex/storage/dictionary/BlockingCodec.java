package com.posindex.storage.dictionary;

import com.posindex.config.Constants;
import com.posindex.storage.DictionaryEntry;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * 按块存储词典。
 *
 * 每块一条定长结构的记录，前置 4 字节记录长度以便顺序扫描：
 * 4 × [term_len:u16 LE][term]，[offset:u32 LE]，3 × [aux_len:u32 LE]。
 * 只存储块首词项的偏移与前三个词项的长度，第四个词项的长度会丢失。
 */
public final class BlockingCodec implements DictionaryCodec<DictionaryBlock> {
    private static final int TAIL_BYTES = Integer.BYTES * (1 + Constants.BLOCKING_AUX_FIELDS);

    private final int blockSize;

    public BlockingCodec() {
        this(Constants.DEFAULT_BLOCK_SIZE);
    }

    /**
     * @param blockSize 每条记录实际写入的词项数，不超过槽位数 4
     */
    public BlockingCodec(int blockSize) {
        if (blockSize < 1 || blockSize > Constants.BLOCKING_TERM_SLOTS) {
            throw new IllegalArgumentException("按块存储的 blockSize 必须在 1.." + Constants.BLOCKING_TERM_SLOTS
                + " 之间: " + blockSize);
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
        for (int start = 0; start < sorted.size(); start += blockSize) {
            List<TermBytes.EncodedEntry> block = sorted.subList(start, Math.min(start + blockSize, sorted.size()));
            byte[] record = encodeRecord(block);
            LittleEndian.writeU32(out, record.length);
            out.write(record, 0, record.length);
        }
        return out.toByteArray();
    }

    private byte[] encodeRecord(List<TermBytes.EncodedEntry> block) {
        ByteArrayOutputStream record = new ByteArrayOutputStream();
        for (int slot = 0; slot < Constants.BLOCKING_TERM_SLOTS; slot++) {
            byte[] termBytes = slot < block.size() ? block.get(slot).bytes() : new byte[0];
            if (termBytes.length > Constants.BLOCKING_MAX_TERM_BYTES) {
                throw new IllegalArgumentException("按块存储词项超过 " + Constants.BLOCKING_MAX_TERM_BYTES
                    + " 字节: term=" + block.get(slot).entry().term());
            }
            LittleEndian.writeU16(record, termBytes.length);
            record.write(termBytes, 0, termBytes.length);
        }
        LittleEndian.writeU32(record, block.get(0).entry().offset());
        for (int slot = 0; slot < Constants.BLOCKING_AUX_FIELDS; slot++) {
            long length = slot < block.size() ? block.get(slot).entry().length() : 0L;
            LittleEndian.writeU32(record, length);
        }
        // 第四个词项的长度不写入
        return record.toByteArray();
    }

    @Override
    public List<DictionaryBlock> decode(byte[] data) throws DictionaryCorruptionException {
        if (data == null) {
            throw new IllegalArgumentException("词典数据不能为null");
        }
        ByteBuffer buffer = LittleEndian.wrap(data);
        List<DictionaryBlock> blocks = new ArrayList<>();
        while (buffer.hasRemaining()) {
            int recordStart = buffer.position();
            if (buffer.remaining() < Integer.BYTES) {
                throw new DictionaryCorruptionException("记录长度头被截断", recordStart, blocks);
            }
            long recordLength = LittleEndian.readU32(buffer);
            if (recordLength > buffer.remaining()) {
                throw new DictionaryCorruptionException("记录长度超出数据范围: recordLength=" + recordLength,
                    recordStart, blocks);
            }
            ByteBuffer record = buffer.slice(buffer.position(), (int) recordLength).order(buffer.order());
            buffer.position(buffer.position() + (int) recordLength);
            blocks.add(decodeRecord(record, recordStart, blocks));
        }
        return blocks;
    }

    private DictionaryBlock decodeRecord(ByteBuffer record, int recordStart, List<DictionaryBlock> decoded)
            throws DictionaryCorruptionException {
        List<String> terms = new ArrayList<>(Constants.BLOCKING_TERM_SLOTS);
        for (int slot = 0; slot < Constants.BLOCKING_TERM_SLOTS; slot++) {
            if (record.remaining() < Short.BYTES) {
                throw new DictionaryCorruptionException("词项长度字段被截断: slot=" + slot, recordStart, decoded);
            }
            int termLength = LittleEndian.readU16(record);
            if (termLength > record.remaining()) {
                throw new DictionaryCorruptionException("词项字节被截断: slot=" + slot + ", termLength=" + termLength,
                    recordStart, decoded);
            }
            byte[] termBytes = new byte[termLength];
            record.get(termBytes);
            if (termLength > 0) {
                terms.add(TermBytes.decode(termBytes, recordStart));
            }
        }
        if (record.remaining() != TAIL_BYTES) {
            throw new DictionaryCorruptionException("偏移与长度字段不完整: remaining=" + record.remaining(),
                recordStart, decoded);
        }
        long offset = LittleEndian.readU32(record);
        List<Long> auxLengths = new ArrayList<>(Constants.BLOCKING_AUX_FIELDS);
        for (int index = 0; index < Constants.BLOCKING_AUX_FIELDS; index++) {
            auxLengths.add(LittleEndian.readU32(record));
        }
        return new DictionaryBlock(terms, offset, auxLengths);
    }

    /**
     * 由按块记录还原完整词条。第四个词项的长度取下一块的偏移与其偏移之差，
     * 最后一块则以倒排数据区末尾为界。
     *
     * @param blocks 按写入顺序的记录
     * @param recordsEnd 倒排数据区末尾偏移，不含 CRC 页脚
     * @return 按词序的词条
     * @throws IllegalArgumentException 推导出的长度为负时抛出
     */
    public static List<DictionaryEntry> toEntries(List<DictionaryBlock> blocks, long recordsEnd) {
        List<DictionaryEntry> entries = new ArrayList<>();
        for (int blockIndex = 0; blockIndex < blocks.size(); blockIndex++) {
            DictionaryBlock block = blocks.get(blockIndex);
            long end = blockIndex + 1 < blocks.size() ? blocks.get(blockIndex + 1).offset() : recordsEnd;
            for (int slot = 0; slot < block.termCount(); slot++) {
                long offset = block.termOffset(slot);
                long length = block.termLength(slot).orElse(end - offset);
                if (length < 0) {
                    throw new IllegalArgumentException("推导出的倒排长度为负: term=" + block.terms().get(slot)
                        + ", offset=" + offset + ", end=" + end);
                }
                entries.add(new DictionaryEntry(block.terms().get(slot), offset, length));
            }
        }
        return entries;
    }
}
