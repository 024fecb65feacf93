package com.textlocator.match;

import com.textlocator.config.Constants;
import com.textlocator.config.LocatorConfig;
import com.textlocator.text.EditDistance;
import com.textlocator.text.NormalizedText;
import com.textlocator.text.Token;
import com.textlocator.text.Tokenizer;
import com.textlocator.text.WhitespaceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 容忍拼写错误与单词替换的词级滑动窗口匹配。
 *
 * <p>窗口大小取查询词数 n 及 n±1。窗口得分 = 0.7 × 命中比例 + 0.3 × 顺序一致性，
 * 命中比例为每个查询词在窗口内最佳相似度的均值，顺序一致性为模糊 LCS 长度除以 max(n, 窗口大小)。
 */
public class FuzzyStrategy implements MatchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(FuzzyStrategy.class);
    private static final double SCORE_EPSILON = 1e-9;

    private final Tokenizer tokenizer;
    private final double minScore;
    private final int maxContentLength;
    private final int maxQueryLength;
    private final long maxCost;

    public FuzzyStrategy() {
        this(LocatorConfig.defaults());
    }

    public FuzzyStrategy(LocatorConfig config) {
        this.tokenizer = new WhitespaceTokenizer();
        this.minScore = config.getFuzzyMinConfidence();
        this.maxContentLength = config.getMaxFuzzyContentLength();
        this.maxQueryLength = config.getMaxFuzzyQueryLength();
        this.maxCost = config.getMaxStrategyCost();
    }

    @Override
    public Optional<MatchResult> find(String content, String query) {
        if (content.length() > maxContentLength || query.length() > maxQueryLength) {
            logger.debug("跳过模糊匹配: 文本 {} 字符, 查询 {} 字符", content.length(), query.length());
            return Optional.empty();
        }

        List<Token> queryTokens = tokenizer.tokenize(query);
        List<Token> contentTokens = tokenizer.tokenize(content);
        if (queryTokens.isEmpty() || contentTokens.isEmpty()) {
            return Optional.empty();
        }

        int queryCount = queryTokens.size();
        int contentCount = contentTokens.size();
        long estimatedCost = 3L * contentCount * queryCount * (queryCount + 1);
        if (estimatedCost > maxCost) {
            logger.debug("模糊匹配预计成本 {} 超过预算 {}，放弃", estimatedCost, maxCost);
            return Optional.empty();
        }

        double[][] similarity = buildSimilarityMatrix(queryTokens, contentTokens);
        Window best = null;
        for (int windowSize : candidateWindowSizes(queryCount, contentCount)) {
            for (int start = 0; start + windowSize <= contentCount; start++) {
                double score = scoreWindow(similarity, start, windowSize);
                if (best == null || score > best.score() + SCORE_EPSILON) {
                    best = new Window(start, windowSize, score);
                }
            }
        }

        if (best == null || best.score() < minScore) {
            return Optional.empty();
        }
        return resolveSpan(content, query, contentTokens, similarity, best);
    }

    /**
     * 按 n、n-1、n+1 的优先顺序给出窗口大小；文本词数不足时退化为整段文本。
     */
    private List<Integer> candidateWindowSizes(int queryCount, int contentCount) {
        List<Integer> sizes = new ArrayList<>(3);
        for (int size : new int[] {queryCount, queryCount - 1, queryCount + 1}) {
            if (size >= 1 && size <= contentCount && !sizes.contains(size)) {
                sizes.add(size);
            }
        }
        if (sizes.isEmpty()) {
            sizes.add(contentCount);
        }
        return sizes;
    }

    private double[][] buildSimilarityMatrix(List<Token> queryTokens, List<Token> contentTokens) {
        Map<String, double[]> byTerm = new HashMap<>();
        double[][] matrix = new double[queryTokens.size()][contentTokens.size()];
        for (int column = 0; column < contentTokens.size(); column++) {
            String term = contentTokens.get(column).term();
            double[] scores = byTerm.computeIfAbsent(term, key -> {
                double[] computed = new double[queryTokens.size()];
                for (int row = 0; row < queryTokens.size(); row++) {
                    computed[row] = EditDistance.tokenSimilarity(queryTokens.get(row).term(), key);
                }
                return computed;
            });
            for (int row = 0; row < queryTokens.size(); row++) {
                matrix[row][column] = scores[row];
            }
        }
        return matrix;
    }

    private double scoreWindow(double[][] similarity, int start, int windowSize) {
        int queryCount = similarity.length;
        double foundSum = 0.0;
        for (int row = 0; row < queryCount; row++) {
            double bestForToken = 0.0;
            for (int column = start; column < start + windowSize; column++) {
                bestForToken = Math.max(bestForToken, similarity[row][column]);
            }
            foundSum += bestForToken;
        }
        double found = foundSum / queryCount;
        double order = (double) fuzzyLcs(similarity, start, windowSize) / Math.max(queryCount, windowSize);
        return Constants.FUZZY_FOUND_WEIGHT * found + (1.0 - Constants.FUZZY_FOUND_WEIGHT) * order;
    }

    private int fuzzyLcs(double[][] similarity, int start, int windowSize) {
        int[] previous = new int[windowSize + 1];
        int[] current = new int[windowSize + 1];
        for (double[] row : similarity) {
            for (int offset = 1; offset <= windowSize; offset++) {
                if (row[start + offset - 1] > 0.0) {
                    current[offset] = previous[offset - 1] + 1;
                } else {
                    current[offset] = Math.max(previous[offset], current[offset - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[windowSize];
    }

    /**
     * 以窗口内首个和末个命中词为边界；长度或覆盖率不足时向外逐词扩展，从不收缩。
     */
    private Optional<MatchResult> resolveSpan(String content, String query, List<Token> contentTokens,
                                              double[][] similarity, Window window) {
        int first = -1;
        int last = -1;
        for (double[] row : similarity) {
            int bestColumn = -1;
            double bestValue = 0.0;
            for (int column = window.start(); column < window.start() + window.size(); column++) {
                if (row[column] > bestValue) {
                    bestValue = row[column];
                    bestColumn = column;
                }
            }
            if (bestColumn >= 0) {
                first = first < 0 ? bestColumn : Math.min(first, bestColumn);
                last = Math.max(last, bestColumn);
            }
        }
        if (first < 0) {
            return Optional.empty();
        }

        int queryCount = similarity.length;
        int queryLength = NormalizedText.collapsedLength(query);
        int extensions = 0;
        while (!isAdequate(queryLength, contentTokens, similarity, first, last)) {
            boolean canExtendLeft = first > 0;
            boolean canExtendRight = last < contentTokens.size() - 1;
            if (extensions >= queryCount || (!canExtendLeft && !canExtendRight)) {
                logger.debug("模糊匹配区间无法扩展到满足覆盖要求，交由下一策略");
                return Optional.empty();
            }
            boolean rightHelps = canExtendRight && coversUncovered(similarity, last + 1, first, last);
            boolean leftHelps = canExtendLeft && coversUncovered(similarity, first - 1, first, last);
            if (rightHelps || (!leftHelps && canExtendRight)) {
                last++;
            } else {
                first--;
            }
            extensions++;
        }

        int start = contentTokens.get(first).startOffset();
        int end = contentTokens.get(last).endOffset();
        double confidence = Math.min(1.0, Math.max(MatchKind.FUZZY.baseConfidence(), window.score()));
        return Optional.of(MatchResult.of(content, start, end, confidence, MatchKind.FUZZY));
    }

    private boolean isAdequate(int queryLength, List<Token> contentTokens, double[][] similarity, int first, int last) {
        int spanLength = contentTokens.get(last).endOffset() - contentTokens.get(first).startOffset();
        if (spanLength < Constants.FUZZY_MIN_LENGTH_RATIO * queryLength) {
            return false;
        }
        int covered = 0;
        for (double[] row : similarity) {
            if (appearsIn(row, first, last)) {
                covered++;
            }
        }
        return covered >= Constants.FUZZY_MIN_TOKEN_COVERAGE * similarity.length;
    }

    private boolean coversUncovered(double[][] similarity, int column, int first, int last) {
        for (double[] row : similarity) {
            if (row[column] > 0.0 && !appearsIn(row, first, last)) {
                return true;
            }
        }
        return false;
    }

    private boolean appearsIn(double[] row, int first, int last) {
        for (int column = first; column <= last; column++) {
            if (row[column] > 0.0) {
                return true;
            }
        }
        return false;
    }

    private record Window(int start, int size, double score) {
    }
}
