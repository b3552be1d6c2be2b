package com.posindex.storage;

import com.posindex.config.Constants;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;

/**
 * 倒排文件写入器，按词序逐条写入倒排记录，关闭时追加 CRC32。
 *
 * 记录格式：docCount、skipCount、skip(from, to, jump)*、docId增量*、(位置数, 位置增量*)*，均为 VarInt。
 * 返回的词条区间首尾相接，后一条记录的偏移等于前一条的偏移加长度。
 */
public final class PostingsWriter implements AutoCloseable {
    private final RandomAccessFile randomAccessFile;
    private final String postingsFileName;
    private String lastTerm;
    private int termCount;
    private boolean closed;

    /**
     * 创建倒排写入器并写入文件头。
     *
     * @param file 倒排文件
     * @throws IOException 初始化失败时抛出
     */
    public PostingsWriter(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.postingsFileName = file.getName();
        this.randomAccessFile.setLength(0L);
        this.randomAccessFile.writeInt(Constants.POSTINGS_MAGIC);
        this.randomAccessFile.writeShort(Constants.FORMAT_VERSION);
    }

    /**
     * 写入一个词项的倒排记录，要求词项按字典序严格递增。
     *
     * @param term 词项
     * @param postingList 倒排列表
     * @return 该记录的词典词条
     * @throws IOException 写入失败时抛出
     */
    public DictionaryEntry writePostingList(String term, PostingList postingList) throws IOException {
        ensureOpen();
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (postingList == null) {
            throw new IllegalArgumentException("倒排列表不能为null: term=" + term);
        }
        if (lastTerm != null && term.compareTo(lastTerm) <= 0) {
            throw new IllegalArgumentException("term 必须严格递增，last=" + lastTerm + ", current=" + term);
        }

        byte[] record = encodeRecord(postingList);
        long offset = randomAccessFile.getFilePointer();
        randomAccessFile.write(record);
        lastTerm = term;
        termCount++;
        return new DictionaryEntry(term, offset, record.length);
    }

    public int getTermCount() {
        return termCount;
    }

    /**
     * 将倒排列表编码为一条记录。
     */
    static byte[] encodeRecord(PostingList postingList) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        VarIntCodec.writeVarInt(postingList.size(), buffer);

        SkipPointer[] skips = postingList.skips();
        VarIntCodec.writeVarInt(skips.length, buffer);
        for (SkipPointer skip : skips) {
            VarIntCodec.writeVarInt(skip.fromIndex(), buffer);
            VarIntCodec.writeVarInt(skip.toIndex(), buffer);
            VarIntCodec.writeVarInt(skip.jump(), buffer);
        }

        DeltaCodec.writeDeltas(postingList.docIds(), buffer);
        for (int index = 0; index < postingList.size(); index++) {
            int[] positions = postingList.positionsAt(index);
            VarIntCodec.writeVarInt(positions.length, buffer);
            DeltaCodec.writeDeltas(positions, buffer);
        }
        return buffer.toByteArray();
    }

    /**
     * 关闭写入器并追加文件级 CRC32。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("关闭倒排写入器失败: file=" + postingsFileName + ", termCount=" + termCount, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    /**
     * 校验写入器处于可写状态。
     */
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsWriter 已关闭");
        }
    }
}
