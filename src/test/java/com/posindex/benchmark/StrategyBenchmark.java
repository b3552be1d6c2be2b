package com.posindex.benchmark;

import com.posindex.config.EngineConfig;
import com.posindex.document.TokenizedDocument;
import com.posindex.index.IndexBuilder;
import com.posindex.index.InvertedIndex;
import com.posindex.index.SkipStrategy;
import com.posindex.query.BooleanEvaluator;
import com.posindex.query.BooleanResult;
import com.posindex.query.DistributionStrategy;
import com.posindex.query.EvaluationStrategy;
import com.posindex.query.NotPlacement;
import com.posindex.query.PhraseResult;
import com.posindex.query.PhraseVerifier;
import com.posindex.query.QueryNode;
import com.posindex.query.QueryParser;
import com.posindex.query.TermOrdering;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 布尔求值策略与跳表步长的性能基准
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class StrategyBenchmark {

    @Param({"SQRT", "DIV10", "FIXED_50", "FIXED_200"})
    public SkipStrategy skipStrategy;

    @Param({"ASCENDING_DOC_FREQ", "DESCENDING_DOC_FREQ"})
    public TermOrdering termOrdering;

    @Param({"OR_THEN_AND", "AND_DISTRIBUTED_INTO_OR"})
    public DistributionStrategy distribution;

    @Param({"LATE_NOT", "EARLY_NOT"})
    public NotPlacement notPlacement;

    private BooleanEvaluator withSkips;
    private BooleanEvaluator withoutSkips;
    private PhraseVerifier phraseVerifier;
    private QueryNode conjunction;
    private QueryNode mixed;

    @Setup
    public void setup() {
        EngineConfig config = EngineConfig.defaults();
        config.setSkipStrategy(skipStrategy);
        config.setIndexThreads(4);
        IndexBuilder builder = new IndexBuilder(config);

        // Zipf 风格分布：低编号词项出现在大多数文档中
        Random random = new Random(7L);
        for (int doc = 0; doc < 20000; doc++) {
            List<String> terms = new ArrayList<>(40);
            for (int position = 0; position < 40; position++) {
                terms.add("t" + (int) (Math.pow(random.nextDouble(), 3) * 500));
            }
            builder.addDocument(TokenizedDocument.of("doc" + doc, terms));
        }
        InvertedIndex index = builder.build().index();

        EvaluationStrategy strategy = new EvaluationStrategy(termOrdering, distribution, notPlacement, true);
        withSkips = new BooleanEvaluator(index, strategy);
        withoutSkips = new BooleanEvaluator(index, strategy.withSkips(false));
        phraseVerifier = new PhraseVerifier(index);

        QueryParser parser = new QueryParser();
        conjunction = parser.parse("t0 t1 t40 t120");
        mixed = parser.parse("t0 (t30 OR t60 OR t90) -t2");
    }

    @Benchmark
    public BooleanResult conjunctionWithSkips() {
        return withSkips.evaluate(conjunction);
    }

    @Benchmark
    public BooleanResult conjunctionWithoutSkips() {
        return withoutSkips.evaluate(conjunction);
    }

    @Benchmark
    public BooleanResult mixedQuery() {
        return withSkips.evaluate(mixed);
    }

    @Benchmark
    public PhraseResult phrase() {
        return phraseVerifier.verify(List.of("t0", "t1"));
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(StrategyBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
