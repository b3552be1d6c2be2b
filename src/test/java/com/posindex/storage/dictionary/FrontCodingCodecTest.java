package com.posindex.storage.dictionary;

import com.posindex.storage.DictionaryEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 前端编码词典测试。
 */
class FrontCodingCodecTest {

    private static final List<DictionaryEntry> AUTOMAT = List.of(
        new DictionaryEntry("automation", 28, 3),
        new DictionaryEntry("automata", 6, 10),
        new DictionaryEntry("automatic", 21, 7),
        new DictionaryEntry("automate", 16, 5));

    @Test
    @DisplayName("块内第二个词项只存储后缀")
    void encodesSharedPrefixAgainstBlockBase() {
        byte[] data = new FrontCodingCodec().encode(AUTOMAT);

        assertEquals(18 + 11 + 12 + 13, data.length);
        assertEquals(0, data[0]);
        assertEquals(8, data[1]);
        assertEquals(7, data[18]);
        assertEquals(1, data[19]);
        assertEquals('e', data[20]);
        // offset 16 小端写入
        assertArrayEquals(new byte[]{16, 0, 0, 0}, Arrays.copyOfRange(data, 21, 25));
    }

    @Test
    void decodeReturnsEntriesInByteOrder() throws DictionaryCorruptionException {
        FrontCodingCodec codec = new FrontCodingCodec();
        List<DictionaryEntry> decoded = codec.decode(codec.encode(AUTOMAT));

        assertEquals(List.of(
            new DictionaryEntry("automata", 6, 10),
            new DictionaryEntry("automate", 16, 5),
            new DictionaryEntry("automatic", 21, 7),
            new DictionaryEntry("automation", 28, 3)), decoded);
    }

    @Test
    @DisplayName("每个新块以完整基准词开头")
    void blockBoundaryStartsNewBase() throws DictionaryCorruptionException {
        FrontCodingCodec codec = new FrontCodingCodec(2);
        byte[] data = codec.encode(AUTOMAT);

        // 第三个词项位于新块，记录起点为 18 + 11
        assertEquals(0, data[29]);
        assertEquals(9, data[30]);
        assertEquals(AUTOMAT.size(), codec.decode(data).size());
    }

    @Test
    void sortsByUnsignedUtf8Bytes() throws DictionaryCorruptionException {
        FrontCodingCodec codec = new FrontCodingCodec();
        List<DictionaryEntry> entries = List.of(
            new DictionaryEntry("zebra", 10, 1),
            new DictionaryEntry("\u00e9t\u00e9", 11, 1),
            new DictionaryEntry("Apple", 12, 1));

        List<String> terms = codec.decode(codec.encode(entries)).stream().map(DictionaryEntry::term).toList();

        assertEquals(List.of("Apple", "zebra", "\u00e9t\u00e9"), terms);
    }

    @Test
    void rejectsOversizedTermAndOutOfRangeValues() {
        FrontCodingCodec codec = new FrontCodingCodec();
        String longTerm = "x".repeat(256);

        assertThrows(IllegalArgumentException.class,
            () -> codec.encode(List.of(new DictionaryEntry(longTerm, 0, 1))));
        assertThrows(IllegalArgumentException.class,
            () -> codec.encode(List.of(new DictionaryEntry("big", 0x1_0000_0000L, 1))));
        assertThrows(IllegalArgumentException.class,
            () -> codec.encode(List.of(new DictionaryEntry("dup", 0, 1), new DictionaryEntry("dup", 1, 1))));
        assertThrows(IllegalArgumentException.class, () -> new FrontCodingCodec(0));
    }

    @Test
    void emptyInputEncodesToEmptyData() throws DictionaryCorruptionException {
        FrontCodingCodec codec = new FrontCodingCodec();
        assertEquals(0, codec.encode(List.of()).length);
        assertEquals(List.of(), codec.decode(new byte[0]));
    }

    @Test
    @DisplayName("截断数据报告损坏位置并保留已解码记录")
    void truncatedDataKeepsPartialResult() {
        FrontCodingCodec codec = new FrontCodingCodec();
        byte[] data = codec.encode(AUTOMAT);
        byte[] truncated = Arrays.copyOf(data, data.length - 3);

        DictionaryCorruptionException exception = assertThrows(DictionaryCorruptionException.class,
            () -> codec.decode(truncated));

        assertEquals(41, exception.getPosition());
        assertEquals(3, exception.partialResult().size());
        assertEquals(new DictionaryEntry("automatic", 21, 7), exception.partialResult().get(2));
    }

    @Test
    void truncatedHeaderIsCorruption() {
        FrontCodingCodec codec = new FrontCodingCodec();
        byte[] data = Arrays.copyOf(codec.encode(AUTOMAT.subList(1, 2)), 19);

        DictionaryCorruptionException exception = assertThrows(DictionaryCorruptionException.class,
            () -> codec.decode(data));
        assertEquals(18, exception.getPosition());
        assertEquals(1, exception.partialResult().size());
    }

    @Test
    void prefixLongerThanBaseIsCorruption() {
        byte[] data = {
            0, 1, 'a', 0, 0, 0, 0, 1, 0, 0, 0,
            5, 0, 0, 0, 0, 0, 1, 0, 0, 0
        };

        DictionaryCorruptionException exception = assertThrows(DictionaryCorruptionException.class,
            () -> new FrontCodingCodec().decode(data));
        assertEquals(11, exception.getPosition());
        assertEquals(List.of(new DictionaryEntry("a", 0, 1)), exception.partialResult());
    }

    @Test
    void invalidUtf8IsReplaced() throws DictionaryCorruptionException {
        byte[] data = {0, 2, (byte) 0xC3, 0x28, 7, 0, 0, 0, 2, 0, 0, 0};

        List<DictionaryEntry> decoded = new FrontCodingCodec().decode(data);

        assertEquals(List.of(new DictionaryEntry("\uFFFD(", 7, 2)), decoded);
    }

    @Test
    void writeAndReadFile(@TempDir Path tempDir) throws IOException {
        FrontCodingCodec codec = new FrontCodingCodec();
        Path file = tempDir.resolve(DictionaryFormat.FRONT_CODING.fileName());
        codec.write(AUTOMAT, file);

        assertEquals(4, codec.read(file).size());
        assertEquals("automata", new String(Arrays.copyOfRange(codec.encode(AUTOMAT), 2, 10), StandardCharsets.UTF_8));
    }
}
