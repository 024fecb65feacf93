package com.textlocator.patch;

import com.textlocator.config.Constants;
import com.textlocator.match.MatchResult;
import com.textlocator.match.TextLocator;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 判断在锚点之后插入内容是否落在自然边界（句末、段末），否则尝试给出更好的锚点。
 */
public class AnchorValidator {
    private static final Pattern DIALOGUE_TAG = Pattern.compile(
        "\"[^\"]*\"\\s*(he|she|they|it|\\w+)\\s+(said|whispered|shouted|asked|replied|answered|muttered|declared|announced)\\w*\\.?\\s*$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern FOLLOWED_BY_CAPITAL = Pattern.compile("^\\s+\\p{Lu}");
    private static final Pattern FOLLOWED_BY_BLANK_LINE = Pattern.compile("^[ \\t\\r]*\\n\\s*\\n");
    private static final Pattern FOLLOWED_BY_NEWLINE = Pattern.compile("^\\s*\\n");
    private static final Pattern CAPITAL = Pattern.compile("\\p{Lu}");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");
    private static final int LOOK_AROUND = 100;
    private static final int SENTENCE_WINDOW = 200;

    private final TextLocator locator;

    public AnchorValidator() {
        this(new TextLocator());
    }

    public AnchorValidator(TextLocator locator) {
        this.locator = locator;
    }

    public AnchorCheck validate(String content, String anchorText) {
        if (content == null || content.isEmpty() || anchorText == null || anchorText.isEmpty()) {
            return AnchorCheck.rejected(-1, "Content or anchor text is empty", null);
        }

        MatchResult match = locator.locate(content, anchorText);
        if (!match.found()) {
            return AnchorCheck.rejected(-1, "Anchor text not found in document", null);
        }

        int insertionPoint = match.endIndex();
        boolean anchorEndsWell = endsAtNaturalBoundary(anchorText);
        boolean pointIsAppropriate = isInsertionPointAppropriate(content, insertionPoint);
        if (anchorEndsWell && pointIsAppropriate) {
            return AnchorCheck.ok(insertionPoint);
        }

        String betterAnchor = findBetterAnchor(content, match.index(), match.length());
        if (betterAnchor != null) {
            String message = !anchorEndsWell
                ? "Anchor text appears incomplete (doesn't end at sentence/paragraph boundary). Better anchor text suggested."
                : "Insertion would occur in middle of paragraph/sentence. Better anchor text suggested.";
            return AnchorCheck.rejected(insertionPoint, message, betterAnchor);
        }
        String message = !anchorEndsWell
            ? "Anchor text appears incomplete (doesn't end at natural boundary) and no better anchor found"
            : "Insertion point is inappropriate (middle of paragraph/sentence) and no better anchor found";
        return AnchorCheck.rejected(insertionPoint, message, null);
    }

    /**
     * 锚点本身是否以句末标点、引号、对白标签或段落分隔结尾；很短的锚点视为有意为之。
     */
    boolean endsAtNaturalBoundary(String anchorText) {
        String trimmed = anchorText.stripTrailing();
        if (trimmed.endsWith(".") || trimmed.endsWith("!") || trimmed.endsWith("?")) {
            return true;
        }
        if (trimmed.endsWith("\"") || trimmed.endsWith("'")) {
            return true;
        }
        if (DIALOGUE_TAG.matcher(trimmed).find()) {
            return true;
        }
        if (trimmed.length() < Constants.ANCHOR_SHORT_LENGTH) {
            return true;
        }
        return anchorText.endsWith("\n\n") || anchorText.endsWith("\r\n\r\n");
    }

    /**
     * 插入点是否位于句末或段末，且不在未闭合的引号内部。
     */
    boolean isInsertionPointAppropriate(String content, int insertionPoint) {
        if (insertionPoint >= content.length()) {
            return true;
        }

        String after = content.substring(insertionPoint, Math.min(content.length(), insertionPoint + LOOK_AROUND));
        String before = content.substring(Math.max(0, insertionPoint - LOOK_AROUND), insertionPoint);

        if (FOLLOWED_BY_BLANK_LINE.matcher(after).find()) {
            return true;
        }
        boolean quoteClosedBefore = before.stripTrailing().endsWith("\"");
        if (quoteClosedBefore && FOLLOWED_BY_NEWLINE.matcher(after).find()) {
            return true;
        }
        if (before.chars().filter(ch -> ch == '"').count() % 2 == 1) {
            return false;
        }
        if (FOLLOWED_BY_CAPITAL.matcher(after).find() && SENTENCE_END.matcher(lastChar(before)).find()) {
            return true;
        }

        String following = content.substring(insertionPoint, Math.min(content.length(), insertionPoint + SENTENCE_WINDOW));
        Matcher nextCapital = CAPITAL.matcher(following);
        if (nextCapital.find()) {
            return SENTENCE_END.matcher(following.substring(0, nextCapital.start())).find()
                || SENTENCE_END.matcher(lastChar(before)).find();
        }
        return true;
    }

    /**
     * 从命中区间末尾向后寻找最近的句末或段末，构造以该边界结尾的锚点。
     */
    String findBetterAnchor(String content, int matchIndex, int matchLength) {
        int searchStart = matchIndex + matchLength;
        int searchEnd = Math.min(content.length(), searchStart + Constants.ANCHOR_MAX_SEARCH_DISTANCE);
        int anchorStart = Math.max(0, matchIndex - Constants.ANCHOR_LEADING_CONTEXT);

        for (int index = searchStart; index < searchEnd; index++) {
            char current = content.charAt(index);
            boolean sentenceEnd = (current == '.' || current == '!' || current == '?')
                && (index + 1 == content.length() || Character.isWhitespace(content.charAt(index + 1)));
            boolean paragraphEnd = current == '\n' && index + 1 < content.length() && content.charAt(index + 1) == '\n';
            if (!sentenceEnd && !paragraphEnd) {
                continue;
            }
            int anchorEnd = sentenceEnd ? index + 1 : index;
            String candidate = content.substring(anchorStart, anchorEnd).trim();
            if (candidate.length() >= Constants.ANCHOR_MIN_LENGTH) {
                return candidate;
            }
        }
        return null;
    }

    private static String lastChar(String text) {
        String trimmed = text.stripTrailing();
        return trimmed.isEmpty() ? "" : trimmed.substring(trimmed.length() - 1);
    }
}
