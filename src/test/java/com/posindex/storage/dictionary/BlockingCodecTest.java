package com.posindex.storage.dictionary;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.posindex.storage.DictionaryEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 按块存储词典测试。
 */
class BlockingCodecTest {

    private static final List<DictionaryEntry> GREEK = List.of(
        new DictionaryEntry("omega", 48, 2),
        new DictionaryEntry("gamma", 41, 7),
        new DictionaryEntry("alpha", 6, 10),
        new DictionaryEntry("delta", 36, 5),
        new DictionaryEntry("beta", 16, 20));

    @Test
    void encodesLengthPrefixedRecords() {
        byte[] data = new BlockingCodec().encode(GREEK);

        assertEquals(80, data.length);
        assertArrayEquals(new byte[]{43, 0, 0, 0}, Arrays.copyOfRange(data, 0, 4));
        assertArrayEquals(new byte[]{29, 0, 0, 0}, Arrays.copyOfRange(data, 47, 51));
        assertArrayEquals(new byte[]{5, 0}, Arrays.copyOfRange(data, 4, 6));
    }

    @Test
    @DisplayName("块内偏移由首偏移与前序长度推导，第四个词项没有长度")
    void decodedBlocksExposeDerivedOffsets() throws DictionaryCorruptionException {
        BlockingCodec codec = new BlockingCodec();
        List<DictionaryBlock> blocks = codec.decode(codec.encode(GREEK));

        assertEquals(2, blocks.size());
        DictionaryBlock first = blocks.get(0);
        assertEquals(List.of("alpha", "beta", "delta", "gamma"), first.terms());
        assertEquals(6, first.offset());
        assertEquals(List.of(10L, 20L, 5L), first.auxLengths());
        assertEquals(6, first.termOffset(0));
        assertEquals(16, first.termOffset(1));
        assertEquals(36, first.termOffset(2));
        assertEquals(41, first.termOffset(3));
        assertEquals(OptionalLong.of(5), first.termLength(2));
        assertFalse(first.termLength(3).isPresent());

        DictionaryBlock second = blocks.get(1);
        assertEquals(List.of("omega"), second.terms());
        assertEquals(48, second.offset());
        assertEquals(List.of(2L, 0L, 0L), second.auxLengths());
        assertThrows(IndexOutOfBoundsException.class, () -> second.termOffset(1));
    }

    @Test
    void smallerBlockSizeProducesMoreRecords() throws DictionaryCorruptionException {
        BlockingCodec codec = new BlockingCodec(2);
        List<DictionaryBlock> blocks = codec.decode(codec.encode(GREEK));

        assertEquals(3, blocks.size());
        assertEquals(List.of("delta", "gamma"), blocks.get(1).terms());
        assertEquals(OptionalLong.of(7), blocks.get(1).termLength(1));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 5, -1})
    void rejectsBlockSizeOutsideSlotRange(int blockSize) {
        assertThrows(IllegalArgumentException.class, () -> new BlockingCodec(blockSize));
    }

    @Test
    void formatClampsBlockingBlockSizeWithWarning() {
        Logger logger = (Logger) LoggerFactory.getLogger(DictionaryFormat.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertEquals(4, DictionaryFormat.BLOCKING.codec(16).blockSize());
            assertEquals(1, appender.list.size());
            assertEquals(Level.WARN, appender.list.get(0).getLevel());

            assertEquals(16, DictionaryFormat.FRONT_CODING.codec(16).blockSize());
            assertInstanceOf(BlockingCodec.class, DictionaryFormat.BLOCKING.codec(2));
            assertEquals(1, appender.list.size());
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    @DisplayName("由块记录还原词条，第四个词项长度由下一块偏移或数据区末尾推出")
    void recoversEntriesFromBlocks() throws DictionaryCorruptionException {
        BlockingCodec codec = new BlockingCodec();
        List<DictionaryBlock> blocks = codec.decode(codec.encode(GREEK));

        List<DictionaryEntry> entries = BlockingCodec.toEntries(blocks, 50);

        assertEquals(List.of(
            new DictionaryEntry("alpha", 6, 10),
            new DictionaryEntry("beta", 16, 20),
            new DictionaryEntry("delta", 36, 5),
            new DictionaryEntry("gamma", 41, 7),
            new DictionaryEntry("omega", 48, 2)), entries);
    }

    @Test
    void recoveryUsesRecordsEndForFullLastBlock() throws DictionaryCorruptionException {
        BlockingCodec codec = new BlockingCodec();
        List<DictionaryEntry> lastFour = List.of(GREEK.get(0), GREEK.get(1), GREEK.get(3), GREEK.get(4));
        List<DictionaryBlock> blocks = codec.decode(codec.encode(lastFour));

        assertEquals(1, blocks.size());
        assertEquals(new DictionaryEntry("omega", 48, 2), BlockingCodec.toEntries(blocks, 50).get(3));
        assertThrows(IllegalArgumentException.class, () -> BlockingCodec.toEntries(blocks, 30));
    }

    @Test
    void truncatedRecordKeepsPartialBlocks() {
        BlockingCodec codec = new BlockingCodec();
        byte[] data = codec.encode(GREEK);

        DictionaryCorruptionException exception = assertThrows(DictionaryCorruptionException.class,
            () -> codec.decode(Arrays.copyOf(data, data.length - 1)));

        assertEquals(47, exception.getPosition());
        assertEquals(1, exception.partialResult().size());
        assertTrue(exception.getMessage().contains("position=47"));
    }

    @Test
    void truncatedLengthHeaderIsCorruption() {
        BlockingCodec codec = new BlockingCodec();
        byte[] data = codec.encode(GREEK);

        DictionaryCorruptionException exception = assertThrows(DictionaryCorruptionException.class,
            () -> codec.decode(Arrays.copyOf(data, 49)));
        assertEquals(47, exception.getPosition());
    }

    @Test
    @DisplayName("记录长度与字段不符时报告损坏")
    void recordWithMissingTailIsCorruption() {
        // 四个空槽位后只剩 4 字节
        byte[] data = {12, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1, 0, 0, 0};

        DictionaryCorruptionException exception = assertThrows(DictionaryCorruptionException.class,
            () -> new BlockingCodec().decode(data));
        assertEquals(0, exception.getPosition());
        assertTrue(exception.partialResult().isEmpty());
    }

    @Test
    void rejectsOutOfRangeLength() {
        assertThrows(IllegalArgumentException.class,
            () -> new BlockingCodec().encode(List.of(new DictionaryEntry("a", 0, 0x1_0000_0000L))));
    }
}
