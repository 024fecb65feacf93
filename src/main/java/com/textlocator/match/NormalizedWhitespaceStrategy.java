package com.textlocator.match;

import com.textlocator.text.NormalizedText;

import java.util.Optional;

public class NormalizedWhitespaceStrategy implements MatchStrategy {

    /**
     * 折叠大小写与空白后查找。命中区间的起点和终点分别经位置映射换算，
     * 原文中被折叠掉的空白因此完整地落在区间内。
     */
    @Override
    public Optional<MatchResult> find(String content, String query) {
        String normalizedQuery = NormalizedText.collapseWhitespace(query);
        if (normalizedQuery.isEmpty()) {
            return Optional.empty();
        }
        NormalizedText normalizedContent = NormalizedText.whitespaceCollapsed(content);
        int normalizedIndex = normalizedContent.text().indexOf(normalizedQuery);
        if (normalizedIndex < 0) {
            return Optional.empty();
        }
        int start = normalizedContent.sourceStart(normalizedIndex);
        int end = normalizedContent.sourceEnd(normalizedIndex + normalizedQuery.length());
        return Optional.of(MatchResult.of(content, start, end,
            MatchKind.NORMALIZED_WHITESPACE.baseConfidence(), MatchKind.NORMALIZED_WHITESPACE));
    }
}
