package com.textlocator.highlight;

import com.textlocator.config.Constants;
import com.textlocator.match.MatchResult;

import java.util.Optional;

/**
 * 按半径截取命中位置两侧的原文，窗口边界向外对齐到完整单词。
 */
public class ContextExtractor {
    private final int radius;

    public ContextExtractor() {
        this(Constants.DEFAULT_CONTEXT_RADIUS);
    }

    public ContextExtractor(int radius) {
        this.radius = Math.max(0, radius);
    }

    public Optional<MatchContext> extract(String content, MatchResult match) {
        if (content == null || content.isEmpty() || match == null || !match.found()) {
            return Optional.empty();
        }
        int matchStart = Math.min(match.index(), content.length());
        int matchEnd = Math.min(match.endIndex(), content.length());

        int windowStart = alignStart(content, Math.max(0, matchStart - radius));
        int windowEnd = alignEnd(content, Math.min(content.length(), matchEnd + radius));

        HighlightSpan relative = new HighlightSpan(matchStart - windowStart, matchEnd - windowStart);
        return Optional.of(new MatchContext(
            content.substring(windowStart, windowEnd),
            windowStart,
            countLineNumber(content, matchStart),
            relative,
            match.matchType(),
            match.confidence(),
            windowStart > 0,
            windowEnd < content.length()
        ));
    }

    public static Optional<MatchContext> extract(String content, MatchResult match, int radius) {
        return new ContextExtractor(radius).extract(content, match);
    }

    private int alignStart(String text, int index) {
        int aligned = index;
        while (aligned > 0 && isWordChar(text.charAt(aligned - 1))) {
            aligned--;
        }
        return aligned;
    }

    private int alignEnd(String text, int index) {
        int aligned = index;
        while (aligned < text.length() && isWordChar(text.charAt(aligned))) {
            aligned++;
        }
        return aligned;
    }

    private boolean isWordChar(char value) {
        return Character.isLetterOrDigit(value) || value == '_';
    }

    static int countLineNumber(String content, int offset) {
        int lineNumber = 1;
        for (int index = 0; index < offset && index < content.length(); index++) {
            if (content.charAt(index) == '\n') {
                lineNumber++;
            }
        }
        return lineNumber;
    }
}
