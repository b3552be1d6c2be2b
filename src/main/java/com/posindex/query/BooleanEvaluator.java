package com.posindex.query;

import com.posindex.index.InvertedIndex;
import com.posindex.storage.PostingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 布尔查询求值器。
 *
 * AND 链被展开为肯定与否定两组操作数，按 {@link EvaluationStrategy} 决定处理顺序、OR 的展开方式与 NOT 的时机；
 * 所有策略组合得到的结果相同。
 */
public final class BooleanEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(BooleanEvaluator.class);

    private final InvertedIndex index;
    private final EvaluationStrategy strategy;
    private final PhraseVerifier phraseVerifier;

    public BooleanEvaluator(InvertedIndex index) {
        this(index, EvaluationStrategy.defaults());
    }

    public BooleanEvaluator(InvertedIndex index, EvaluationStrategy strategy) {
        if (index == null || strategy == null) {
            throw new IllegalArgumentException("索引与求值策略不能为null");
        }
        this.index = index;
        this.strategy = strategy;
        this.phraseVerifier = new PhraseVerifier(index);
    }

    /**
     * 求值查询语法树。
     *
     * @param query 查询
     * @return 命中文档与未知词项
     */
    public BooleanResult evaluate(QueryNode query) {
        if (query == null) {
            throw new IllegalArgumentException("查询不能为null");
        }
        Set<String> missingTerms = new LinkedHashSet<>();
        int[] docIds = evaluateNode(query, missingTerms).docIds();
        logger.debug("布尔查询完成: hits={}, missing={}, strategy={}", docIds.length, missingTerms, strategy);
        return new BooleanResult(index.documents().externalIds(docIds), missingTerms);
    }

    /**
     * 全部词项的 AND。
     */
    public BooleanResult andTerms(List<String> terms) {
        return evaluate(chain(terms, QueryNode.BoolOp.AND));
    }

    /**
     * 全部词项的 OR。
     */
    public BooleanResult orTerms(List<String> terms) {
        return evaluate(chain(terms, QueryNode.BoolOp.OR));
    }

    public EvaluationStrategy strategy() {
        return strategy;
    }

    private static QueryNode chain(List<String> terms, QueryNode.BoolOp op) {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("词项列表不能为空");
        }
        QueryNode node = new QueryNode.TermQuery(terms.get(0));
        for (int position = 1; position < terms.size(); position++) {
            node = new QueryNode.BooleanQuery(op, node, new QueryNode.TermQuery(terms.get(position)));
        }
        return node;
    }

    private Operand evaluateNode(QueryNode node, Set<String> missingTerms) {
        if (node instanceof QueryNode.TermQuery termQuery) {
            Optional<PostingList> postingList = index.postings(termQuery.term());
            if (postingList.isEmpty()) {
                missingTerms.add(termQuery.term());
                return Operand.EMPTY;
            }
            return Operand.of(postingList.get());
        }
        if (node instanceof QueryNode.PhraseQuery phraseQuery) {
            PhraseVerifier.Candidates candidates = phraseVerifier.match(phraseQuery.terms(), missingTerms);
            if (candidates == null) {
                return Operand.EMPTY;
            }
            return Operand.of(candidates.matches().keySet().stream().mapToInt(Integer::intValue).toArray());
        }
        if (node instanceof QueryNode.NotQuery notQuery) {
            return Operand.of(PostingMerger.difference(index.documents().allDocIds(),
                evaluateNode(notQuery.child(), missingTerms).docIds()));
        }
        QueryNode.BooleanQuery booleanQuery = (QueryNode.BooleanQuery) node;
        if (booleanQuery.op() == QueryNode.BoolOp.OR) {
            int[] result = new int[0];
            for (QueryNode branch : flatten(booleanQuery, QueryNode.BoolOp.OR)) {
                result = PostingMerger.union(result, evaluateNode(branch, missingTerms).docIds());
            }
            return Operand.of(result);
        }

        List<QueryNode> positives = new ArrayList<>();
        List<QueryNode> negatives = new ArrayList<>();
        for (QueryNode conjunct : flatten(booleanQuery, QueryNode.BoolOp.AND)) {
            if (conjunct instanceof QueryNode.NotQuery notQuery) {
                negatives.add(notQuery.child());
            } else {
                positives.add(conjunct);
            }
        }
        return Operand.of(evaluateConjunction(positives, negatives, missingTerms));
    }

    /**
     * 求值 positives[0] AND ... AND NOT negatives[0] AND NOT ...。
     */
    private int[] evaluateConjunction(List<QueryNode> positives, List<QueryNode> negatives, Set<String> missingTerms) {
        if (strategy.distribution() == DistributionStrategy.AND_DISTRIBUTED_INTO_OR) {
            for (int position = 0; position < positives.size(); position++) {
                QueryNode candidate = positives.get(position);
                if (candidate instanceof QueryNode.BooleanQuery booleanQuery && booleanQuery.op() == QueryNode.BoolOp.OR) {
                    return distributeInto(booleanQuery, positives, position, negatives, missingTerms);
                }
            }
        }

        List<Operand> operands = new ArrayList<>(positives.size());
        for (QueryNode positive : positives) {
            operands.add(evaluateNode(positive, missingTerms));
        }
        List<int[]> excluded = new ArrayList<>(negatives.size());
        for (QueryNode negative : negatives) {
            excluded.add(evaluateNode(negative, missingTerms).docIds());
        }

        if (operands.isEmpty()) {
            int[] result = index.documents().allDocIds();
            for (int[] docIds : excluded) {
                result = PostingMerger.difference(result, docIds);
            }
            return result;
        }

        Comparator<Operand> bySize = Comparator.comparingInt(Operand::size);
        operands.sort(strategy.termOrdering() == TermOrdering.ASCENDING_DOC_FREQ ? bySize : bySize.reversed());

        Operand current = operands.get(0);
        if (strategy.notPlacement() == NotPlacement.EARLY_NOT) {
            current = subtractAll(current, excluded);
        }
        for (int position = 1; position < operands.size() && current.size() > 0; position++) {
            current = intersect(current, operands.get(position));
        }
        if (strategy.notPlacement() == NotPlacement.LATE_NOT) {
            current = subtractAll(current, excluded);
        }
        return current.docIds();
    }

    /**
     * 将其余操作数分别与 OR 的每个分支求交后合并。
     */
    private int[] distributeInto(QueryNode.BooleanQuery orNode, List<QueryNode> positives, int orPosition,
                                 List<QueryNode> negatives, Set<String> missingTerms) {
        int[] result = new int[0];
        for (QueryNode branch : flatten(orNode, QueryNode.BoolOp.OR)) {
            List<QueryNode> expanded = new ArrayList<>(positives);
            expanded.remove(orPosition);
            List<QueryNode> branchNegatives = new ArrayList<>(negatives);
            if (branch instanceof QueryNode.NotQuery notQuery) {
                branchNegatives.add(notQuery.child());
            } else if (branch instanceof QueryNode.BooleanQuery inner && inner.op() == QueryNode.BoolOp.AND) {
                for (QueryNode conjunct : flatten(inner, QueryNode.BoolOp.AND)) {
                    if (conjunct instanceof QueryNode.NotQuery notQuery) {
                        branchNegatives.add(notQuery.child());
                    } else {
                        expanded.add(conjunct);
                    }
                }
            } else {
                expanded.add(branch);
            }
            result = PostingMerger.union(result, evaluateConjunction(expanded, branchNegatives, missingTerms));
        }
        return result;
    }

    private Operand intersect(Operand left, Operand right) {
        if (strategy.useSkips()) {
            if (left.postingList() != null && right.postingList() != null) {
                return Operand.of(PostingMerger.intersectWithSkips(left.postingList(), right.postingList()));
            }
            if (right.postingList() != null) {
                return Operand.of(PostingMerger.intersectWithSkips(left.docIds(), right.postingList()));
            }
            if (left.postingList() != null) {
                return Operand.of(PostingMerger.intersectWithSkips(right.docIds(), left.postingList()));
            }
        }
        return Operand.of(PostingMerger.intersect(left.docIds(), right.docIds()));
    }

    private Operand subtractAll(Operand operand, List<int[]> excluded) {
        if (excluded.isEmpty()) {
            return operand;
        }
        int[] result = operand.docIds();
        for (int[] docIds : excluded) {
            result = PostingMerger.difference(result, docIds);
        }
        return Operand.of(result);
    }

    /**
     * 展开同一运算符的连续嵌套，保持从左到右的顺序。
     */
    private static List<QueryNode> flatten(QueryNode node, QueryNode.BoolOp op) {
        List<QueryNode> operands = new ArrayList<>();
        if (node instanceof QueryNode.BooleanQuery booleanQuery && booleanQuery.op() == op) {
            operands.addAll(flatten(booleanQuery.left(), op));
            operands.addAll(flatten(booleanQuery.right(), op));
        } else {
            operands.add(node);
        }
        return operands;
    }

    /**
     * 求值中间结果；直接来自倒排表时保留原列表以便使用跳表，文档ID数组按需取出。
     */
    private static final class Operand {
        static final Operand EMPTY = new Operand(new int[0], null);

        private int[] docIds;
        private final PostingList postingList;

        private Operand(int[] docIds, PostingList postingList) {
            this.docIds = docIds;
            this.postingList = postingList;
        }

        static Operand of(int[] docIds) {
            return new Operand(docIds, null);
        }

        static Operand of(PostingList postingList) {
            return new Operand(null, postingList);
        }

        PostingList postingList() {
            return postingList;
        }

        int[] docIds() {
            if (docIds == null) {
                docIds = postingList.docIds();
            }
            return docIds;
        }

        int size() {
            return postingList != null ? postingList.size() : docIds.length;
        }
    }
}
