package com.posindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.posindex.config.EngineConfig;
import com.posindex.query.NotPlacement;
import com.posindex.query.TermOrdering;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private Path tokenizedDir;
    private Path indexDir;

    @BeforeEach
    void setUp() throws IOException {
        tokenizedDir = tempDir.resolve("tokenized");
        indexDir = tempDir.resolve("index");
        Files.createDirectories(tokenizedDir);
        Files.writeString(tokenizedDir.resolve("D1.txt"), "new york meetup group");
        Files.writeString(tokenizedDir.resolve("D2.txt"), "new york tech workshop");
        Files.writeString(tokenizedDir.resolve("D3.txt"), "python workshop");
    }

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(0, new CommandLine(new MainCommand()).execute("--help"));
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        MainCommand command = new MainCommand();
        ParseResult parseResult = new CommandLine(command).parseArgs(
            "--term-ordering", "DESCENDING_DOC_FREQ", "--not-placement", "EARLY_NOT", "--no-skips", "search", "a");

        assertNotNull(parseResult.subcommand());
        assertEquals("search", parseResult.subcommand().commandSpec().name());
        EngineConfig config = command.toConfig();
        assertEquals(TermOrdering.DESCENDING_DOC_FREQ, config.getTermOrdering());
        assertEquals(NotPlacement.EARLY_NOT, config.getNotPlacement());
        assertFalse(config.isUseSkips());
    }

    @Test
    void testIndexThenQuery() {
        assertEquals(0, run("index", tokenizedDir.toString()).exitCode());
        assertTrue(Files.exists(indexDir.resolve("postings.bin")));

        Output search = run("search", "new york -tech");
        assertEquals(0, search.exitCode());
        assertTrue(search.out().contains("D1.txt"));
        assertFalse(search.out().contains("D2.txt"));
        assertTrue(search.out().contains("共 1 条匹配"));

        Output phrase = run("phrase", "new", "york");
        assertEquals(0, phrase.exitCode());
        assertTrue(phrase.out().contains("D2.txt [0]"));

        Output rank = run("rank", "workshop", "-n", "1");
        assertEquals(0, rank.exitCode());
        assertTrue(rank.out().contains("1. D3.txt"));
        assertFalse(rank.out().contains("D2.txt"));
    }

    @Test
    void testMissingTermsAreReported() {
        run("index", tokenizedDir.toString());

        Output output = run("search", "python OR zebra");

        assertEquals(0, output.exitCode());
        assertTrue(output.out().contains("zebra"));
        assertTrue(output.out().contains("D3.txt"));
    }

    @Test
    void testSyntaxErrorReturnsTwo() {
        run("index", tokenizedDir.toString());
        assertEquals(2, run("search", "(new york").exitCode());
    }

    @Test
    void testDictPrintsDecodedRecords() {
        run("index", tokenizedDir.toString());

        Output frontCoded = run("dict");
        assertEquals(0, frontCoded.exitCode());
        assertTrue(frontCoded.out().contains("term=group"));
        assertTrue(frontCoded.out().contains("共 7 条记录"));

        Output blocking = run("dict", "--format", "BLOCKING", "-l", "1");
        assertEquals(0, blocking.exitCode());
        assertTrue(blocking.out().contains("共 2 条记录"));
    }

    @Test
    void testDictDefaultsToFormatChosenAtIndexTime() {
        assertEquals(0, run("index", tokenizedDir.toString(), "--dict-format", "BLOCKING").exitCode());

        Output output = run("dict");

        assertEquals(0, output.exitCode());
        assertTrue(output.out().contains("共 2 条记录"));
    }

    @Test
    void testIndexWithOversizedTermStillSucceeds() throws IOException {
        Files.writeString(tokenizedDir.resolve("D4.txt"), "python " + "x".repeat(300));

        Output index = run("index", tokenizedDir.toString());
        assertEquals(0, index.exitCode());
        assertTrue(index.out().contains("[BLOCKING]"));

        assertEquals(1, run("dict").exitCode());
        assertEquals(0, run("dict", "--format", "BLOCKING").exitCode());
        assertTrue(run("search", "python").out().contains("D4.txt"));
    }

    @Test
    void testQueryWithoutIndexFails() {
        assertEquals(1, run("search", "new").exitCode());
    }

    private Output run(String... args) {
        String[] fullArgs = new String[args.length + 2];
        fullArgs[0] = "--index-dir";
        fullArgs[1] = indexDir.toString();
        System.arraycopy(args, 0, fullArgs, 2, args.length);

        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        int exitCode;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            exitCode = new CommandLine(new MainCommand()).execute(fullArgs);
        } finally {
            System.setOut(originalOut);
        }
        return new Output(exitCode, outputBuffer.toString(StandardCharsets.UTF_8));
    }

    private record Output(int exitCode, String out) {
    }
}
