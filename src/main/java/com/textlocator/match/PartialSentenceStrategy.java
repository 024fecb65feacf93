package com.textlocator.match;

import com.textlocator.config.LocatorConfig;
import com.textlocator.config.Constants;
import com.textlocator.text.Token;
import com.textlocator.text.Tokenizer;
import com.textlocator.text.WhitespaceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 级联的最后一级：把改写过的长句与原文中规模相近的词窗口做词级 LCS 对齐。
 *
 * <p>只对"像句子"的查询生效。窗口大小在 [n - n/4, n + n/4] 之间，取对齐词数最多的窗口，
 * 同分时取更小、更靠左的窗口。置信度即对齐比例，可能低于 0.6。
 */
public class PartialSentenceStrategy implements MatchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(PartialSentenceStrategy.class);
    private static final Pattern TERMINAL_PUNCTUATION = Pattern.compile("[.!?]");

    private final Tokenizer tokenizer;
    private final int sentenceMinQueryLength;
    private final double minFraction;
    private final long maxCost;

    public PartialSentenceStrategy() {
        this(LocatorConfig.defaults());
    }

    public PartialSentenceStrategy(LocatorConfig config) {
        this.tokenizer = new WhitespaceTokenizer();
        this.sentenceMinQueryLength = config.getSentenceMinQueryLength();
        this.minFraction = config.getPartialSentenceMinFraction();
        this.maxCost = config.getMaxStrategyCost();
    }

    @Override
    public Optional<MatchResult> find(String content, String query) {
        if (!isSentenceLike(query)) {
            return Optional.empty();
        }
        List<Token> queryTokens = tokenizer.tokenize(query);
        List<Token> contentTokens = tokenizer.tokenize(content);
        int queryCount = queryTokens.size();
        int contentCount = contentTokens.size();
        if (queryCount < Constants.SENTENCE_MIN_TOKENS || contentCount == 0) {
            return Optional.empty();
        }

        int minWindow = Math.min(Math.max(1, queryCount - queryCount / 4), contentCount);
        int maxWindow = Math.min(queryCount + queryCount / 4, contentCount);
        long estimatedCost = (long) contentCount * queryCount * maxWindow;
        if (estimatedCost > maxCost) {
            logger.debug("句子匹配预计成本 {} 超过预算 {}，放弃", estimatedCost, maxCost);
            return Optional.empty();
        }

        String[] queryKeys = Tokenizer.terms(queryTokens);
        String[] contentKeys = Tokenizer.terms(contentTokens);
        int[][] table = new int[queryCount + 1][maxWindow + 1];

        int bestLcs = 0;
        int bestStart = -1;
        int bestSize = Integer.MAX_VALUE;
        for (int start = 0; start < contentCount; start++) {
            int limit = Math.min(maxWindow, contentCount - start);
            if (limit < minWindow) {
                break;
            }
            fillLcsTable(table, queryKeys, contentKeys, start, limit);
            for (int size = minWindow; size <= limit; size++) {
                int lcs = table[queryCount][size];
                if (lcs > bestLcs || (lcs == bestLcs && lcs > 0 && size < bestSize)) {
                    bestLcs = lcs;
                    bestStart = start;
                    bestSize = size;
                }
            }
        }

        double fraction = (double) bestLcs / queryCount;
        if (bestStart < 0 || fraction < minFraction) {
            return Optional.empty();
        }

        fillLcsTable(table, queryKeys, contentKeys, bestStart, bestSize);
        int[] aligned = alignedBounds(table, queryKeys, contentKeys, bestStart, bestSize);
        int start = contentTokens.get(bestStart + aligned[0]).startOffset();
        int end = contentTokens.get(bestStart + aligned[1]).endOffset();
        return Optional.of(MatchResult.of(content, start, end, fraction, MatchKind.PARTIAL_SENTENCE));
    }

    /**
     * 长度超过阈值或包含句末标点的查询视为句子。
     */
    boolean isSentenceLike(String query) {
        String trimmed = query.trim();
        return trimmed.length() > sentenceMinQueryLength || TERMINAL_PUNCTUATION.matcher(trimmed).find();
    }

    private void fillLcsTable(int[][] table, String[] queryKeys, String[] contentKeys, int start, int size) {
        for (int row = 1; row <= queryKeys.length; row++) {
            for (int column = 1; column <= size; column++) {
                if (queryKeys[row - 1].equals(contentKeys[start + column - 1])) {
                    table[row][column] = table[row - 1][column - 1] + 1;
                } else {
                    table[row][column] = Math.max(table[row - 1][column], table[row][column - 1]);
                }
            }
        }
    }

    /**
     * 回溯 LCS，返回窗口内首个与末个对齐词的相对下标。
     */
    private int[] alignedBounds(int[][] table, String[] queryKeys, String[] contentKeys, int start, int size) {
        int row = queryKeys.length;
        int column = size;
        int firstAligned = size;
        int lastAligned = -1;
        while (row > 0 && column > 0) {
            if (queryKeys[row - 1].equals(contentKeys[start + column - 1])) {
                firstAligned = column - 1;
                lastAligned = Math.max(lastAligned, column - 1);
                row--;
                column--;
            } else if (table[row - 1][column] >= table[row][column - 1]) {
                row--;
            } else {
                column--;
            }
        }
        return new int[] {firstAligned, lastAligned};
    }
}
