package com.textlocator.match;

import com.textlocator.config.Constants;

/**
 * 匹配层级，按从严到宽的级联顺序声明。
 *
 * <p>置信度与长度充分性比例作为数据挂在层级上：前三级为固定置信度，
 * FUZZY 记录的是下限，PARTIAL_SENTENCE 的置信度按对齐比例逐次计算。
 */
public enum MatchKind {
    EXACT("Exact", Constants.EXACT_CONFIDENCE, Constants.STRICT_MIN_LENGTH_RATIO),
    CASE_INSENSITIVE("Case-insensitive", Constants.CASE_INSENSITIVE_CONFIDENCE, Constants.STRICT_MIN_LENGTH_RATIO),
    NORMALIZED_WHITESPACE("Normalized whitespace", Constants.NORMALIZED_WHITESPACE_CONFIDENCE, Constants.STRICT_MIN_LENGTH_RATIO),
    FUZZY("Fuzzy", Constants.FUZZY_MIN_CONFIDENCE, Constants.FUZZY_MIN_LENGTH_RATIO),
    PARTIAL_SENTENCE("Partial sentence", 0.0, 0.0),
    NO_MATCH("No match", 0.0, 0.0);

    private final String label;
    private final double baseConfidence;
    private final double minLengthRatio;

    MatchKind(String label, double baseConfidence, double minLengthRatio) {
        this.label = label;
        this.baseConfidence = baseConfidence;
        this.minLengthRatio = minLengthRatio;
    }

    public String label() {
        return label;
    }

    public double baseConfidence() {
        return baseConfidence;
    }

    /**
     * 匹配长度相对查询长度必须达到的比例，0 表示该层级不做要求。
     */
    public double minLengthRatio() {
        return minLengthRatio;
    }
}
