package com.posindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.zip.CRC32;

/**
 * 存储文件工具方法，封装 CRC32 页脚与按区间读取逻辑。
 */
final class StorageFileUtil {
    private static final int BUFFER_SIZE = 8 * 1024;

    private StorageFileUtil() {
    }

    /**
     * 计算文件开头 length 字节的 CRC32，读取后恢复文件指针。
     */
    static long computeCrc32(RandomAccessFile randomAccessFile, long length) throws IOException {
        long originalPointer = randomAccessFile.getFilePointer();
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[BUFFER_SIZE];
        long remainingBytes = length;
        randomAccessFile.seek(0L);
        while (remainingBytes > 0) {
            int readBytes = randomAccessFile.read(buffer, 0, (int) Math.min(buffer.length, remainingBytes));
            if (readBytes < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF");
            }
            crc32.update(buffer, 0, readBytes);
            remainingBytes -= readBytes;
        }
        randomAccessFile.seek(originalPointer);
        return crc32.getValue();
    }

    /**
     * 在文件尾部追加 CRC32 页脚。
     */
    static void appendCrc32Footer(RandomAccessFile randomAccessFile) throws IOException {
        long dataLength = randomAccessFile.length();
        long crc32Value = computeCrc32(randomAccessFile, dataLength);
        randomAccessFile.seek(dataLength);
        randomAccessFile.writeInt((int) crc32Value);
    }

    /**
     * 验证尾部 CRC32 并返回数据区长度。
     *
     * @param fileName 文件名（用于错误消息）
     * @return 不含 CRC 页脚的数据区长度
     * @throws IOException CRC 不匹配或文件过短时抛出
     */
    static long verifyCrc32Footer(RandomAccessFile randomAccessFile, String fileName) throws IOException {
        long fileLength = randomAccessFile.length();
        if (fileLength < Integer.BYTES) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        long dataLength = fileLength - Integer.BYTES;
        randomAccessFile.seek(dataLength);
        long expectedCrc32 = Integer.toUnsignedLong(randomAccessFile.readInt());
        long actualCrc32 = computeCrc32(randomAccessFile, dataLength);
        if (actualCrc32 != expectedCrc32) {
            throw new IOException("CRC32 校验失败: " + fileName + ", expected=" + expectedCrc32 + ", actual=" + actualCrc32);
        }
        return dataLength;
    }

    /**
     * 读取 [offset, offset + length) 区间的字节。
     */
    static byte[] readRange(RandomAccessFile randomAccessFile, long offset, int length) throws IOException {
        byte[] bytes = new byte[length];
        randomAccessFile.seek(offset);
        randomAccessFile.readFully(bytes);
        return bytes;
    }
}
