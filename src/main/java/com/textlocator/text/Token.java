package com.textlocator.text;

/**
 * 单词：term 为比较键，[startOffset, endOffset) 为它在原文中覆盖的完整区间。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {

    public Token {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("非法偏移: [" + startOffset + ", " + endOffset + ")");
        }
    }

    /**
     * 原文中覆盖的字符数，包含被比较键忽略的首尾标点。
     */
    public int sourceLength() {
        return endOffset - startOffset;
    }
}
