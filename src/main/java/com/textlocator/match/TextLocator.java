package com.textlocator.match;

import com.textlocator.config.LocatorConfig;
import com.textlocator.text.NormalizedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 级联文本定位器：按从严到宽的固定顺序依次尝试各策略，返回第一个命中的结果。
 *
 * <p>实例只持有不可变的策略列表，可在多线程间共享。未命中是正常结果，不抛异常。
 */
public class TextLocator {
    private static final Logger logger = LoggerFactory.getLogger(TextLocator.class);
    private static final int PREVIEW_LENGTH = 50;

    private final List<MatchStrategy> strategies;

    public TextLocator() {
        this(LocatorConfig.defaults());
    }

    public TextLocator(LocatorConfig config) {
        this(List.of(
            new ExactStrategy(),
            new CaseInsensitiveStrategy(),
            new NormalizedWhitespaceStrategy(),
            new FuzzyStrategy(config),
            new PartialSentenceStrategy(config)
        ));
    }

    TextLocator(List<MatchStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public MatchResult locate(String content, String query) {
        if (content == null || content.isEmpty() || query == null || query.isEmpty()) {
            return MatchResult.noMatch();
        }

        logger.debug("定位文本: '{}'", preview(query));
        for (MatchStrategy strategy : strategies) {
            Optional<MatchResult> candidate = strategy.find(content, query);
            if (candidate.isEmpty()) {
                continue;
            }
            MatchResult result = candidate.get();
            if (!isLengthAdequate(result, query)) {
                logger.debug("{} 命中长度 {} 不足以覆盖查询长度 {}，继续下一策略",
                    result.matchType().label(), result.length(), NormalizedText.collapsedLength(query));
                continue;
            }
            logger.debug("{} 命中: index={}, length={}, confidence={}",
                result.matchType().label(), result.index(), result.length(), result.confidence());
            return result;
        }

        logger.debug("所有策略均未命中: '{}'", preview(query));
        return MatchResult.noMatch();
    }

    /**
     * 命中长度是否达到所属层级要求的查询长度比例。查询长度按折叠空白后计算，
     * 排版时多出的空白不计入。
     */
    static boolean isLengthAdequate(MatchResult result, String query) {
        return result.length() >= result.matchType().minLengthRatio() * NormalizedText.collapsedLength(query);
    }

    static String preview(String text) {
        if (text.length() <= PREVIEW_LENGTH) {
            return text;
        }
        int cut = PREVIEW_LENGTH;
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + "...";
    }
}
