package com.posindex.storage;

import com.posindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;

/**
 * 倒排文件读取器，只能通过词典词条的 (offset, length) 区间读取倒排记录。
 */
public final class PostingsReader implements AutoCloseable {
    private final RandomAccessFile randomAccessFile;
    private final long dataLength;
    private boolean closed;

    /**
     * 构造读取器并完成文件头与 CRC 校验。
     *
     * @param file 倒排文件
     * @throws IOException 文件损坏或版本不兼容时抛出
     */
    public PostingsReader(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "r");
        try {
            this.dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, file.getName());
            this.randomAccessFile.seek(0L);
            int magic = randomAccessFile.readInt();
            if (magic != Constants.POSTINGS_MAGIC) {
                throw new IOException("倒排文件 magic 不匹配: " + file.getName());
            }
            short version = randomAccessFile.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new IOException("倒排文件版本不支持: " + version);
            }
        } catch (IOException exception) {
            randomAccessFile.close();
            throw exception;
        }
    }

    /**
     * 读取词条指向的倒排记录。
     *
     * @param entry 词典词条
     * @return 解码后的倒排列表
     * @throws IOException 区间越界或记录损坏时抛出
     */
    public PostingList read(DictionaryEntry entry) throws IOException {
        ensureOpen();
        if (entry == null) {
            throw new IllegalArgumentException("词条不能为null");
        }
        if (entry.offset() < Constants.POSTINGS_HEADER_BYTES || entry.end() > dataLength
                || entry.length() > Integer.MAX_VALUE) {
            throw new IOException("无效倒排区间: term=" + entry.term() + ", offset=" + entry.offset()
                + ", length=" + entry.length() + ", dataLength=" + dataLength);
        }
        byte[] record = StorageFileUtil.readRange(randomAccessFile, entry.offset(), (int) entry.length());
        try {
            return decodeRecord(record);
        } catch (IOException | IllegalArgumentException exception) {
            throw new IOException("倒排记录损坏: term=" + entry.term() + ", offset=" + entry.offset(), exception);
        }
    }

    /**
     * 倒排数据区长度（不含 CRC 页脚）。
     */
    public long getDataLength() {
        return dataLength;
    }

    /**
     * 解码一条完整记录，记录必须被恰好消费完。
     */
    static PostingList decodeRecord(byte[] record) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(record);
        int documentCount = VarIntCodec.readVarInt(buf);
        int skipCount = VarIntCodec.readVarInt(buf);
        if (documentCount > record.length || skipCount > documentCount) {
            throw new IOException("倒排块计数非法: docCount=" + documentCount + ", skipCount=" + skipCount);
        }

        SkipPointer[] skips = new SkipPointer[skipCount];
        for (int index = 0; index < skipCount; index++) {
            int from = VarIntCodec.readVarInt(buf);
            int to = VarIntCodec.readVarInt(buf);
            int jump = VarIntCodec.readVarInt(buf);
            skips[index] = new SkipPointer(from, to, jump);
        }

        int[] docIds = DeltaCodec.readDeltas(documentCount, buf);
        int[][] positions = new int[documentCount][];
        for (int index = 0; index < documentCount; index++) {
            int positionCount = VarIntCodec.readVarInt(buf);
            if (positionCount > buf.remaining()) {
                throw new IOException("位置数超出记录长度: index=" + index + ", posCount=" + positionCount);
            }
            positions[index] = DeltaCodec.readDeltas(positionCount, buf);
        }
        if (buf.hasRemaining()) {
            throw new IOException("倒排记录包含未解析字节: " + buf.remaining());
        }
        return new PostingList(docIds, positions, skips);
    }

    /**
     * 关闭底层随机读取句柄。
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        randomAccessFile.close();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsReader 已关闭");
        }
    }
}
