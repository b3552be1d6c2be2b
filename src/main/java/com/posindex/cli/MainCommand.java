package com.posindex.cli;

import com.posindex.config.Constants;
import com.posindex.config.EngineConfig;
import com.posindex.document.DirectoryDocumentSource;
import com.posindex.index.BuildResult;
import com.posindex.index.DocumentError;
import com.posindex.index.IndexBuilder;
import com.posindex.index.InvertedIndex;
import com.posindex.index.SkipStrategy;
import com.posindex.query.BooleanResult;
import com.posindex.query.DistributionStrategy;
import com.posindex.query.NotPlacement;
import com.posindex.query.PhraseResult;
import com.posindex.query.QueryEngine;
import com.posindex.query.QueryParseException;
import com.posindex.query.TermOrdering;
import com.posindex.scoring.RankedHit;
import com.posindex.storage.IndexDirectory;
import com.posindex.storage.IndexMeta;
import com.posindex.storage.dictionary.DictionaryCorruptionException;
import com.posindex.storage.dictionary.DictionaryFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
    name = "pie",
    description = "🔍 位置倒排索引检索引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.PhraseSubcommand.class,
        MainCommand.RankSubcommand.class,
        MainCommand.DictSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    @Option(names = {"--index-dir"}, description = "索引目录路径", defaultValue = "./index")
    private Path indexDir;

    @Option(names = {"--term-ordering"}, description = "AND 词项顺序: ${COMPLETION-CANDIDATES}", defaultValue = "ASCENDING_DOC_FREQ")
    private TermOrdering termOrdering;

    @Option(names = {"--distribution"}, description = "AND/OR 混合求值方式: ${COMPLETION-CANDIDATES}", defaultValue = "OR_THEN_AND")
    private DistributionStrategy distribution;

    @Option(names = {"--not-placement"}, description = "NOT 执行时机: ${COMPLETION-CANDIDATES}", defaultValue = "LATE_NOT")
    private NotPlacement notPlacement;

    @Option(names = {"--no-skips"}, description = "求交时不使用跳表指针")
    private boolean noSkips;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 位置倒排索引检索引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 由全局选项生成引擎配置。
     */
    EngineConfig toConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setIndexDir(indexDir);
        config.setTermOrdering(termOrdering);
        config.setDistributionStrategy(distribution);
        config.setNotPlacement(notPlacement);
        config.setUseSkips(!noSkips);
        return config;
    }

    private QueryEngine openQueryEngine(EngineConfig config) throws IOException {
        InvertedIndex index = IndexDirectory.load(config.getIndexDir());
        return new QueryEngine(index, config);
    }

    private static int resolveThreadCount(int threads) {
        if (threads <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", threads, Constants.DEFAULT_INDEX_THREADS);
            return Constants.DEFAULT_INDEX_THREADS;
        }
        if (threads > Constants.MAX_INDEX_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", threads, Constants.MAX_INDEX_THREADS);
            return Constants.MAX_INDEX_THREADS;
        }
        return threads;
    }

    private static int sanitizeTopN(int rawTopN) {
        if (rawTopN < 0) {
            System.err.printf("⚠️ top=%d 非法，已使用 0%n", rawTopN);
            return 0;
        }
        if (rawTopN > Constants.MAX_TOP_N) {
            System.err.printf("⚠️ top=%d 超过上限 %d，已自动限制%n", rawTopN, Constants.MAX_TOP_N);
            return Constants.MAX_TOP_N;
        }
        return rawTopN;
    }

    private static int fail(String action, Exception exception) {
        System.err.println("❌ " + action + "失败: " + exception.getMessage());
        logger.debug("{}失败", action, exception);
        return 1;
    }

    @Command(name = "index", description = "📂 从分词目录构建索引")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(description = "已分词文本目录，每个 .txt 文件为一个文档", arity = "1")
        private Path tokenizedDir;

        @Option(names = {"--skip-strategy"}, description = "跳表步长策略: ${COMPLETION-CANDIDATES}", defaultValue = "SQRT")
        private SkipStrategy skipStrategy;

        @Option(names = {"--block-size"}, description = "词典压缩块大小", defaultValue = "4")
        private int blockSize;

        @Option(names = {"--threads"}, description = "索引线程数", defaultValue = "1")
        private int threads;

        @Option(names = {"--dict-format"}, description = "缺少 JSON 词典时加载所用的压缩格式: ${COMPLETION-CANDIDATES}", defaultValue = "FRONT_CODING")
        private DictionaryFormat dictionaryFormat;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.toConfig();
            config.setSkipStrategy(skipStrategy);
            config.setBlockSize(blockSize);
            config.setDictionaryFormat(dictionaryFormat);
            config.setIndexThreads(resolveThreadCount(threads));
            try {
                long start = System.currentTimeMillis();
                BuildResult result = IndexBuilder.build(new DirectoryDocumentSource(tokenizedDir), config);
                IndexMeta meta = IndexDirectory.save(result.index(), config.getIndexDir(), config);
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("✅ 索引完成！");
                System.out.println("   文档数: " + meta.docCount());
                System.out.println("   词条数: " + meta.termCount());
                System.out.println("   倒排字节: " + meta.postingsBytes());
                System.out.println("   压缩词典: " + meta.binaryDictionaries());
                System.out.println("   用时: " + elapsed + "ms");
                for (DocumentError error : result.errors()) {
                    System.out.println("⚠️ 跳过 " + error.docId() + ": " + error.reason());
                }
                return 0;
            } catch (Exception exception) {
                return fail("索引", exception);
            }
        }
    }

    @Command(name = "search", description = "🔎 布尔查询（AND / OR / NOT / 括号 / \"短语\"）")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "布尔查询语句", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                BooleanResult result = main.openQueryEngine(main.toConfig()).searchBoolean(query);
                printMissingTerms(result.missingTerms());
                result.docIds().forEach(System.out::println);
                System.out.println("📊 共 " + result.size() + " 条匹配");
                return 0;
            } catch (QueryParseException exception) {
                System.err.println("❌ " + exception.getMessage());
                System.err.println("💡 " + exception.getSuggestion());
                return 2;
            } catch (Exception exception) {
                return fail("搜索", exception);
            }
        }
    }

    @Command(name = "phrase", description = "📝 短语查询")
    static class PhraseSubcommand implements Callable<Integer> {

        @Parameters(description = "短语词项，按顺序", arity = "1..*")
        private List<String> terms;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                PhraseResult result = main.openQueryEngine(main.toConfig()).searchPhrase(terms);
                printMissingTerms(result.missingTerms());
                for (String docId : result.docIds()) {
                    System.out.println(docId + " " + Arrays.toString(result.startPositions(docId)));
                }
                System.out.printf("📊 %d 个文档命中，出现 %d 次；词袋候选 %d 个，误报 %d 个%n",
                    result.matchCount(), result.occurrenceCount(), result.candidateCount(), result.falsePositiveCount());
                return 0;
            } catch (Exception exception) {
                return fail("短语查询", exception);
            }
        }
    }

    @Command(name = "rank", description = "📈 TF-IDF 余弦相似度排序")
    static class RankSubcommand implements Callable<Integer> {

        @Parameters(description = "查询词项", arity = "1..*")
        private List<String> terms;

        @Option(names = {"-n", "--top"}, description = "返回结果数量", defaultValue = "10")
        private int top;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                List<RankedHit> hits = main.openQueryEngine(main.toConfig()).rank(String.join(" ", terms), sanitizeTopN(top));
                if (hits.isEmpty()) {
                    System.out.println("⚠️ 未找到匹配结果");
                    return 0;
                }
                int rank = 1;
                for (RankedHit hit : hits) {
                    System.out.printf("%d. %s (score: %.4f)%n", rank++, hit.docId(), hit.score());
                }
                return 0;
            } catch (Exception exception) {
                return fail("排序", exception);
            }
        }
    }

    @Command(name = "dict", description = "📖 解码并打印压缩词典")
    static class DictSubcommand implements Callable<Integer> {

        @Option(names = {"--format"}, description = "词典格式: ${COMPLETION-CANDIDATES}，默认取索引元数据中的首选格式")
        private DictionaryFormat format;

        @Option(names = {"-l", "--limit"}, description = "最多打印的记录数", defaultValue = "20")
        private int limit;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.toConfig();
            try {
                Path metaPath = config.getIndexDir().resolve(Constants.META_FILE);
                if (Files.exists(metaPath)) {
                    IndexMeta meta = IndexMeta.readFrom(metaPath.toFile());
                    if (meta.dictionaryFormat() != null) {
                        config.setDictionaryFormat(meta.dictionaryFormat());
                    }
                    config.setBlockSize(meta.blockSize());
                }
                DictionaryFormat effectiveFormat = format == null ? config.getDictionaryFormat() : format;
                Path file = config.getIndexDir().resolve(effectiveFormat.fileName());
                if (!Files.exists(file)) {
                    System.err.println("❌ 索引目录中没有 " + effectiveFormat + " 词典: " + file);
                    return 1;
                }
                List<?> records = effectiveFormat.codec(config.getBlockSize()).read(file);
                records.stream().limit(Math.max(limit, 0)).forEach(System.out::println);
                System.out.println("📊 共 " + records.size() + " 条记录");
                return 0;
            } catch (DictionaryCorruptionException exception) {
                exception.partialResult().stream().limit(Math.max(limit, 0)).forEach(System.out::println);
                return fail("词典解码", exception);
            } catch (Exception exception) {
                return fail("读取词典", exception);
            }
        }
    }

    private static void printMissingTerms(Set<String> missingTerms) {
        if (!missingTerms.isEmpty()) {
            System.out.println("⚠️ 词典中不存在: " + missingTerms);
        }
    }
}
