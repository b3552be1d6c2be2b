package com.posindex.storage.dictionary;

import com.posindex.config.Constants;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * 小端无符号整数读写工具，供两种词典编码共享。
 */
final class LittleEndian {
    private LittleEndian() {
    }

    static void writeU8(ByteArrayOutputStream out, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("u8 越界: " + value);
        }
        out.write(value);
    }

    static void writeU16(ByteArrayOutputStream out, int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("u16 越界: " + value);
        }
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
    }

    /**
     * 写入 4 字节无符号整数。
     *
     * @throws IllegalArgumentException 数值不在 [0, 2^32) 内时抛出
     */
    static void writeU32(ByteArrayOutputStream out, long value) {
        if (value < 0 || value > Constants.MAX_U32) {
            throw new IllegalArgumentException("u32 越界: " + value);
        }
        for (int shift = 0; shift < 32; shift += 8) {
            out.write((int) ((value >>> shift) & 0xFF));
        }
    }

    static ByteBuffer wrap(byte[] data) {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    static int readU8(ByteBuffer buffer) {
        return buffer.get() & 0xFF;
    }

    static int readU16(ByteBuffer buffer) {
        return buffer.getShort() & 0xFFFF;
    }

    static long readU32(ByteBuffer buffer) {
        return buffer.getInt() & 0xFFFF_FFFFL;
    }
}
