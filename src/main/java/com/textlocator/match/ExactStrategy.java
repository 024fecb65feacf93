package com.textlocator.match;

import java.util.Optional;

public class ExactStrategy implements MatchStrategy {

    /**
     * 按序号比较查找第一次出现的位置。
     */
    @Override
    public Optional<MatchResult> find(String content, String query) {
        int index = content.indexOf(query);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(content, index, index + query.length(),
            MatchKind.EXACT.baseConfidence(), MatchKind.EXACT));
    }
}
