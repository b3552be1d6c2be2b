package com.posindex.storage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Delta编码器
 *
 * 将严格递增序列（docId、文档内位置）转换为相邻差值，再配合VarInt写出。
 *
 * 示例：[10, 15, 20, 25] -> [10, 5, 5, 5]
 */
public final class DeltaCodec {

    private DeltaCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 对严格递增的非负序列进行Delta编码
     *
     * @param increasing 严格递增序列
     * @return 差值数组
     * @throws IllegalArgumentException 序列为null、含负数或非严格递增时抛出
     */
    public static int[] encode(int[] increasing) {
        if (increasing == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        int[] deltas = new int[increasing.length];
        int previous = 0;
        for (int i = 0; i < increasing.length; i++) {
            if (increasing[i] < 0) {
                throw new IllegalArgumentException("序列不能包含负数，在位置 " + i + " 处: " + increasing[i]);
            }
            if (i > 0 && increasing[i] <= previous) {
                throw new IllegalArgumentException("输入必须严格递增，在位置 " + i + " 处违反");
            }
            deltas[i] = i == 0 ? increasing[i] : increasing[i] - previous;
            previous = increasing[i];
        }
        return deltas;
    }

    /**
     * 从差值还原原始序列
     *
     * @param deltas Delta编码后的数组
     * @return 原始序列
     */
    public static int[] decode(int[] deltas) {
        if (deltas == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        int[] values = new int[deltas.length];
        for (int i = 0; i < deltas.length; i++) {
            values[i] = i == 0 ? deltas[i] : values[i - 1] + deltas[i];
        }
        return values;
    }

    /**
     * Delta + VarInt 写出严格递增序列（不写长度）
     */
    public static void writeDeltas(int[] increasing, OutputStream out) throws IOException {
        for (int delta : encode(increasing)) {
            VarIntCodec.writeVarInt(delta, out);
        }
    }

    /**
     * 读取 count 个 Delta + VarInt 值并还原
     *
     * @throws IOException 数据截断或还原结果非严格递增时抛出
     */
    public static int[] readDeltas(int count, ByteBuffer buf) throws IOException {
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            int delta = VarIntCodec.readVarInt(buf);
            if (i > 0 && delta == 0) {
                throw new IOException("Delta为0，序列不再严格递增: 位置 " + i);
            }
            values[i] = i == 0 ? delta : values[i - 1] + delta;
        }
        return values;
    }
}
