package com.textlocator.highlight;

/**
 * 上下文片段内的高亮区间，start 含、end 不含，均相对片段起点。
 */
public record HighlightSpan(int start, int end) {
}
