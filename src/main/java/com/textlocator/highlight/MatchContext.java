package com.textlocator.highlight;

import com.textlocator.match.MatchKind;

/**
 * 命中位置附近的一段原文，用于展示与人工核对。
 *
 * @param text        片段原文（不含省略号）
 * @param offset      片段在原文中的起始偏移
 * @param lineNumber  命中起点所在行号，从 1 开始
 * @param highlight   命中区间，相对片段起点
 * @param truncatedStart 片段之前是否还有内容
 * @param truncatedEnd   片段之后是否还有内容
 */
public record MatchContext(
        String text,
        int offset,
        int lineNumber,
        HighlightSpan highlight,
        MatchKind matchType,
        double confidence,
        boolean truncatedStart,
        boolean truncatedEnd
) {
    private static final String ANSI_HIGHLIGHT = "\u001B[1;33m";
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ELLIPSIS = "...";

    public String render(boolean ansi) {
        StringBuilder builder = new StringBuilder();
        if (truncatedStart) {
            builder.append(ELLIPSIS);
        }
        builder.append(text, 0, highlight.start());
        if (ansi) {
            builder.append(ANSI_HIGHLIGHT);
        }
        builder.append(text, highlight.start(), highlight.end());
        if (ansi) {
            builder.append(ANSI_RESET);
        }
        builder.append(text, highlight.end(), text.length());
        if (truncatedEnd) {
            builder.append(ELLIPSIS);
        }
        return builder.toString();
    }
}
