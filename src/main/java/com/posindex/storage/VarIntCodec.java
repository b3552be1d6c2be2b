package com.posindex.storage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * VarInt变长整数编解码器
 *
 * 每字节低7位存数据，最高位为1表示后面还有字节。
 * 倒排记录中的计数、docId增量与位置增量大多很小，通常只占1字节。
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将非负int编码为VarInt写入输出流
     *
     * @param value 非负整数
     * @param out 输出流
     * @throws IOException IO异常
     * @throws IllegalArgumentException value为负数时抛出
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        requireNonNegative(value);
        int remaining = value;
        while ((remaining & ~0x7F) != 0) {
            out.write((remaining & 0x7F) | 0x80);
            remaining >>>= 7;
        }
        out.write(remaining);
    }

    /**
     * 从缓冲区读取一个VarInt
     *
     * @param buf 字节缓冲区
     * @return 解码值
     * @throws IOException 缓冲区不足或超过32位时抛出
     */
    public static int readVarInt(ByteBuffer buf) throws IOException {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            if (!buf.hasRemaining()) {
                throw new IOException("VarInt截断: position=" + buf.position());
            }
            int current = buf.get() & 0xFF;
            result |= (current & 0x7F) << shift;
            if ((current & 0x80) == 0) {
                if (result < 0) {
                    throw new IOException("VarInt解码为负数: " + result);
                }
                return result;
            }
        }
        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 计算VarInt编码所需字节数
     *
     * @param value 非负整数
     * @return 字节数，1~5
     */
    public static int varIntSize(int value) {
        requireNonNegative(value);
        int size = 1;
        int remaining = value;
        while ((remaining & ~0x7F) != 0) {
            size++;
            remaining >>>= 7;
        }
        return size;
    }

    private static void requireNonNegative(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
    }
}
