package com.textlocator.match;

import com.textlocator.text.NormalizedText;

import java.util.Optional;

public class CaseInsensitiveStrategy implements MatchStrategy {

    /**
     * 在完整大小写折叠后的文本中查找，再经位置映射换算回原文区间。
     * 折叠可能改变长度（ß → ss），因此区间长度取自映射而不是查询长度。
     */
    @Override
    public Optional<MatchResult> find(String content, String query) {
        String foldedQuery = NormalizedText.foldCase(query);
        if (foldedQuery.isEmpty()) {
            return Optional.empty();
        }
        NormalizedText foldedContent = NormalizedText.caseFolded(content);
        int foldedIndex = foldedContent.text().indexOf(foldedQuery);
        if (foldedIndex < 0) {
            return Optional.empty();
        }
        int start = foldedContent.sourceStart(foldedIndex);
        int end = foldedContent.sourceEnd(foldedIndex + foldedQuery.length());
        return Optional.of(MatchResult.of(content, start, end,
            MatchKind.CASE_INSENSITIVE.baseConfidence(), MatchKind.CASE_INSENSITIVE));
    }
}
