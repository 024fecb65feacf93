package com.textlocator.match;

/**
 * 一次定位的结果。index 为 -1 表示未命中。
 */
public record MatchResult(
    int index,
    int length,
    double confidence,
    MatchKind matchType,
    String matchedText
) {
    private static final MatchResult NONE = new MatchResult(-1, 0, 0.0, MatchKind.NO_MATCH, null);

    public static MatchResult noMatch() {
        return NONE;
    }

    /**
     * 从原文区间构造命中结果，matchedText 直接截取原文。
     */
    public static MatchResult of(String content, int start, int end, double confidence, MatchKind matchType) {
        if (start < 0 || end > content.length() || start > end) {
            throw new IllegalArgumentException(
                "区间越界: [" + start + ", " + end + "), 文本长度 " + content.length());
        }
        return new MatchResult(start, end - start, confidence, matchType, content.substring(start, end));
    }

    public boolean found() {
        return index >= 0 && matchType != MatchKind.NO_MATCH;
    }

    public boolean isExactMatch() {
        return matchType == MatchKind.EXACT;
    }

    public int endIndex() {
        return found() ? index + length : -1;
    }
}
